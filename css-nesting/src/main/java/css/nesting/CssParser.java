package css.nesting;

import css.nesting.CssAst.AtRule;
import css.nesting.CssAst.Declaration;
import css.nesting.CssAst.MarkerStatement;
import css.nesting.CssAst.Node;
import css.nesting.CssAst.StyleRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Reads style sheet text, nested rules included, into a [CssAst] forest.
///
/// Recognised statements:
/// - `selector { ... }` : style rule
/// - `@name prelude { ... }` : at-rule
/// - `@name prelude;` : marker statement
/// - `property: value;` : declaration, with an optional trailing `!important`
///
/// Comments are dropped. Strings and `()`/`[]` groups are opaque, so `;`, `{` and `,` inside
/// them never end a statement. Runs of whitespace outside strings collapse to one space.
/// This is not a full CSS Syntax Level 3 parser: it reads the subset the tree can hold.
public final class CssParser {

    private static final Logger LOG = Logger.getLogger(CssParser.class.getName());

    private static final String IMPORTANT = "!important";

    private final String source;
    private int pos;

    private CssParser(String source) {
        this.source = source;
        this.pos = 0;
    }

    /// @param css the style sheet text
    /// @return the top-level nodes in source order
    /// @throws CssParseException if the text is malformed
    public static List<Node> parse(String css) {
        Objects.requireNonNull(css, "css must not be null");
        LOG.fine(() -> "Parsing style sheet of " + css.length() + " chars");
        return new CssParser(css).parseBody(true);
    }

    private List<Node> parseBody(boolean topLevel) {
        final var nodes = new ArrayList<Node>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= source.length()) {
                if (!topLevel) {
                    throw error("Unclosed block", pos);
                }
                return nodes;
            }
            final char c = source.charAt(pos);
            if (c == '}') {
                if (topLevel) {
                    throw error("Unexpected '}'", pos);
                }
                pos++;
                return nodes;
            }
            if (c == ';') {
                pos++;
                continue;
            }
            final var node = parseStatement();
            LOG.finer(() -> "Parsed " + node.kind() + ": " + node);
            nodes.add(node);
        }
    }

    private Node parseStatement() {
        final int start = pos;
        final var text = new StringBuilder();
        int depth = 0;

        while (pos < source.length()) {
            final char c = source.charAt(pos);
            if (c == '/' && startsWith("/*")) {
                skipComment();
                text.append(' ');
                continue;
            }
            if (c == '"' || c == '\'') {
                final int end = skipString(pos);
                text.append(source, pos, end);
                pos = end;
                continue;
            }
            if (c == '\\' && pos + 1 < source.length()) {
                text.append(c).append(source.charAt(pos + 1));
                pos += 2;
                continue;
            }
            if (c == '(' || c == '[') {
                depth++;
            } else if ((c == ')' || c == ']') && depth > 0) {
                depth--;
            } else if (depth == 0 && (c == '{' || c == ';' || c == '}')) {
                break;
            }
            text.append(c);
            pos++;
        }

        if (depth > 0) {
            throw error("Unclosed '(' or '['", start);
        }
        final var head = collapseWhitespace(text.toString());
        if (pos < source.length() && source.charAt(pos) == '{') {
            pos++;
            final var children = parseBody(false);
            return block(head, children, start);
        }
        if (pos < source.length() && source.charAt(pos) == ';') {
            pos++;
        }
        return head.startsWith("@") ? marker(head, start) : declaration(head, start);
    }

    private Node block(String head, List<Node> children, int start) {
        if (head.startsWith("@")) {
            final int nameEnd = atRuleNameEnd(head);
            final var name = head.substring(1, nameEnd);
            if (name.isEmpty()) {
                throw error("Missing at-rule name", start);
            }
            return new AtRule(name, head.substring(nameEnd).trim(), children);
        }
        if (head.isEmpty()) {
            throw error("Missing selector", start);
        }
        final var selectors = SelectorList.splitTopLevel(head);
        if (selectors.contains("")) {
            throw error("Empty selector in '" + head + "'", start);
        }
        return new StyleRule(new SelectorList(selectors), children);
    }

    private MarkerStatement marker(String head, int start) {
        if (atRuleNameEnd(head) == 1) {
            throw error("Missing at-rule name", start);
        }
        return new MarkerStatement(head);
    }

    private Declaration declaration(String head, int start) {
        final int colon = topLevelColon(head);
        if (colon < 0) {
            throw error("Expected a declaration or a block", start);
        }
        final var property = head.substring(0, colon).trim();
        if (property.isEmpty()) {
            throw error("Missing property name", start);
        }
        var value = head.substring(colon + 1).trim();
        boolean important = false;
        final int bang = value.lastIndexOf('!');
        if (bang >= 0 && value.substring(bang + 1).trim().toLowerCase(Locale.ROOT).equals(IMPORTANT.substring(1))) {
            important = true;
            value = value.substring(0, bang).trim();
        }
        return new Declaration(property, value, important);
    }

    private static int atRuleNameEnd(String head) {
        int i = 1;
        while (i < head.length()) {
            final char c = head.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == '"' || c == '\'') break;
            i++;
        }
        return i;
    }

    private static int topLevelColon(String text) {
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') i++;
                else if (c == quote) quote = 0;
                continue;
            }
            if (c == '"' || c == '\'') quote = c;
            else if (c == '(' || c == '[') depth++;
            else if (c == ')' || c == ']') depth--;
            else if (c == ':' && depth == 0) return i;
        }
        return -1;
    }

    private void skipWhitespaceAndComments() {
        while (pos < source.length()) {
            if (Character.isWhitespace(source.charAt(pos))) {
                pos++;
            } else if (startsWith("/*")) {
                skipComment();
            } else {
                return;
            }
        }
    }

    private void skipComment() {
        final int end = source.indexOf("*/", pos + 2);
        if (end < 0) {
            throw error("Unterminated comment", pos);
        }
        pos = end + 2;
    }

    /// @return the offset just past the closing quote of the string starting at `from`
    private int skipString(int from) {
        final char quote = source.charAt(from);
        int i = from + 1;
        while (i < source.length()) {
            final char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            if (c == '\n') {
                break;
            }
            i++;
        }
        throw error("Unterminated string", from);
    }

    private boolean startsWith(String token) {
        return source.startsWith(token, pos);
    }

    static String collapseWhitespace(String text) {
        final var sb = new StringBuilder(text.length());
        char quote = 0;
        boolean pendingSpace = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (quote == 0 && Character.isWhitespace(c)) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            sb.append(c);
            if (c == '\\' && i + 1 < text.length()) {
                sb.append(text.charAt(++i));
            } else if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            }
        }
        return sb.toString();
    }

    private CssParseException error(String message, int position) {
        return new CssParseException(message, source, position);
    }
}
