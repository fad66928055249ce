package css.nesting;

import css.nesting.CssAst.AtRule;
import css.nesting.CssAst.Declaration;
import css.nesting.CssAst.MarkerStatement;
import css.nesting.CssAst.Node;
import css.nesting.CssAst.StyleRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Rewrites nested style rules into a flat sequence of rules.
///
/// Each rule body is split into runs of consecutive declarations and the nested blocks between
/// them. A run becomes one rule under the selectors resolved so far, wrapped in a new copy of
/// every at-rule that encloses it. Nested rules and at-rules are flattened recursively in place,
/// so output order follows source order at every depth:
///
/// ```css
/// .a { color: red; @media print { .b { color: blue } } color: green }
/// ```
/// becomes
/// ```css
/// .a { color: red }
/// @media print { .a .b { color: blue } }
/// .a { color: green }
/// ```
///
/// The input tree is never modified.
public final class NestingFlattener {

    private static final Logger LOG = Logger.getLogger(NestingFlattener.class.getName());

    private NestingFlattener() {}

    /// Flattens a whole sheet.
    /// @param tree the top-level nodes
    /// @return a new forest in which no style rule contains another rule
    public static List<Node> flatten(List<Node> tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        LOG.fine(() -> "Flattening " + tree.size() + " top-level nodes");
        final var out = new ArrayList<Node>();
        flattenBody(tree, null, AtRuleStack.empty(), out);
        LOG.fine(() -> "Flattened into " + out.size() + " top-level nodes");
        return List.copyOf(out);
    }

    /// Flattens one body into `out`.
    /// @param children the body, in source order
    /// @param selectors the resolved selectors of the enclosing rule, null outside any rule
    /// @param atRules the at-rules enclosing the body
    /// @param out receives the flat nodes
    static void flattenBody(List<Node> children, SelectorList selectors, AtRuleStack atRules, List<Node> out) {
        final var pending = new ArrayList<Node>();

        for (final var child : children) {
            switch (child.kind()) {
                case DECLARATION -> pending.add((Declaration) child);
                case MARKER -> {
                    flush(pending, selectors, atRules, out);
                    final var marker = (MarkerStatement) child;
                    emit(selectors == null ? marker : new StyleRule(selectors, List.of(marker)), atRules, out);
                }
                case STYLE_RULE -> {
                    flush(pending, selectors, atRules, out);
                    final var rule = (StyleRule) child;
                    final var resolved = SelectorAlgebra.combine(selectors, rule.selectors());
                    if (rule.children().isEmpty()) {
                        emit(new StyleRule(resolved, List.of()), atRules, out);
                    } else {
                        flattenBody(rule.children(), resolved, atRules, out);
                    }
                }
                case AT_RULE -> {
                    flush(pending, selectors, atRules, out);
                    final var atRule = (AtRule) child;
                    if (atRule.children().isEmpty()) {
                        emit(atRule, atRules, out);
                    } else {
                        flattenBody(atRule.children(), selectors, atRules.push(atRule), out);
                    }
                }
            }
        }

        flush(pending, selectors, atRules, out);
    }

    private static void flush(List<Node> pending, SelectorList selectors, AtRuleStack atRules, List<Node> out) {
        if (pending.isEmpty()) {
            return;
        }
        final var run = List.copyOf(pending);
        pending.clear();
        LOG.finer(() -> "Flushing " + run.size() + " declarations under "
                + (selectors == null ? "<root>" : "[" + selectors.text() + "]") + " in " + atRules);
        if (selectors == null) {
            out.addAll(atRules.wrap(run));
        } else {
            emit(new StyleRule(selectors, run), atRules, out);
        }
    }

    private static void emit(Node node, AtRuleStack atRules, List<Node> out) {
        out.addAll(atRules.wrap(List.of(node)));
    }
}
