package css.nesting;

import css.nesting.CssAst.AtRule;
import css.nesting.CssAst.Declaration;
import css.nesting.CssAst.MarkerStatement;
import css.nesting.CssAst.Node;
import css.nesting.CssAst.StyleRule;

import java.util.List;
import java.util.Objects;

/// Writes a [CssAst] forest as style sheet text.
///
/// Every block opens on its own line and children are indented by two spaces per level:
/// ```css
/// @layer thing {
///   .a .b {
///     color: orange;
///   }
/// }
/// ```
public final class CssPrinter {

    static final String INDENT = "  ";

    private CssPrinter() {}

    public static String print(List<Node> nodes) {
        Objects.requireNonNull(nodes, "nodes must not be null");
        final var sb = new StringBuilder();
        for (final var node : nodes) {
            print(node, 0, sb);
        }
        return sb.toString();
    }

    public static String print(Node node) {
        Objects.requireNonNull(node, "node must not be null");
        return print(List.of(node));
    }

    private static void print(Node node, int depth, StringBuilder sb) {
        final var indent = INDENT.repeat(depth);
        switch (node.kind()) {
            case STYLE_RULE -> {
                final var rule = (StyleRule) node;
                block(rule.selectors().text(), rule.children(), depth, sb);
            }
            case AT_RULE -> {
                final var atRule = (AtRule) node;
                final var head = atRule.prelude().isEmpty()
                        ? "@" + atRule.name()
                        : "@" + atRule.name() + " " + atRule.prelude();
                block(head, atRule.children(), depth, sb);
            }
            case DECLARATION -> {
                final var decl = (Declaration) node;
                sb.append(indent).append(decl.property()).append(": ").append(decl.value());
                if (decl.important()) {
                    sb.append(" !important");
                }
                sb.append(";\n");
            }
            case MARKER -> sb.append(indent).append(((MarkerStatement) node).text()).append(";\n");
        }
    }

    private static void block(String head, List<Node> children, int depth, StringBuilder sb) {
        final var indent = INDENT.repeat(depth);
        sb.append(indent).append(head).append(" {\n");
        for (final var child : children) {
            print(child, depth + 1, sb);
        }
        sb.append(indent).append("}\n");
    }
}
