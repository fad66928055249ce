package css.nesting;

import css.nesting.CssAst.AtRule;
import css.nesting.CssAst.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// The chain of at-rules enclosing a point in the tree walk, outermost first.
///
/// Only the name and prelude of each at-rule are kept. A push returns a new stack and leaves the
/// receiver untouched, so sibling branches of a walk never see each other's pushes.
public final class AtRuleStack {

    private static final AtRuleStack EMPTY = new AtRuleStack(List.of());

    private final List<AtRule> shells;

    private AtRuleStack(List<AtRule> shells) {
        this.shells = shells;
    }

    public static AtRuleStack empty() {
        return EMPTY;
    }

    /// @param atRule the at-rule being entered; its children are dropped
    /// @return a stack one deeper than this one
    public AtRuleStack push(AtRule atRule) {
        Objects.requireNonNull(atRule, "atRule must not be null");
        final var out = new ArrayList<AtRule>(shells.size() + 1);
        out.addAll(shells);
        out.add(atRule.children().isEmpty() ? atRule : atRule.withChildren(List.of()));
        return new AtRuleStack(List.copyOf(out));
    }

    public boolean isEmpty() {
        return shells.isEmpty();
    }

    public int depth() {
        return shells.size();
    }

    /// Childless at-rules, outermost first.
    public List<AtRule> shells() {
        return shells;
    }

    /// Wraps content in a freshly built copy of every at-rule on the stack.
    /// @param content the nodes to place in the innermost at-rule
    /// @return `content` unchanged if the stack is empty, otherwise a single outermost at-rule
    public List<Node> wrap(List<Node> content) {
        Objects.requireNonNull(content, "content must not be null");
        List<Node> current = List.copyOf(content);
        for (int i = shells.size() - 1; i >= 0; i--) {
            current = List.of(shells.get(i).withChildren(current));
        }
        return current;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AtRuleStack other && shells.equals(other.shells);
    }

    @Override
    public int hashCode() {
        return shells.hashCode();
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder("[");
        for (int i = 0; i < shells.size(); i++) {
            if (i > 0) sb.append(" > ");
            final var shell = shells.get(i);
            sb.append('@').append(shell.name());
            if (!shell.prelude().isEmpty()) sb.append(' ').append(shell.prelude());
        }
        return sb.append(']').toString();
    }
}
