package css.nesting;

import css.nesting.CssAst.Node;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Flattens nested style sheets.
///
/// Usage:
/// ```java
/// String flat = CssNesting.flatten(".a { color: red; .b { color: blue; } }");
/// // .a {
/// //   color: red;
/// // }
/// // .a .b {
/// //   color: blue;
/// // }
/// ```
///
/// Trees built by another parser can be flattened directly with [#flatten(List)] and the result
/// handed to any printer.
public final class CssNesting {

    private static final Logger LOG = Logger.getLogger(CssNesting.class.getName());

    private CssNesting() {}

    /// Parses, flattens and prints a style sheet.
    /// @param css style sheet text that may contain nested rules
    /// @return the flattened style sheet text
    /// @throws NullPointerException if css is null
    /// @throws CssParseException if the text is malformed
    public static String flatten(String css) {
        Objects.requireNonNull(css, "css must not be null");
        LOG.fine(() -> "Flattening style sheet text");
        return CssPrinter.print(flatten(CssParser.parse(css)));
    }

    /// Flattens a parsed style sheet.
    /// @param tree the top-level nodes
    /// @return a new flat forest; `tree` is left untouched
    /// @throws NullPointerException if tree is null
    public static List<Node> flatten(List<Node> tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        return NestingFlattener.flatten(tree);
    }
}
