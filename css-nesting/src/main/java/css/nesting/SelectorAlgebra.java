package css.nesting;

import java.util.ArrayList;
import java.util.Objects;
import java.util.logging.Logger;

/// Composition of a nested rule's selectors with those of its enclosing rule.
///
/// Two forms of composition exist:
/// - a child containing the nesting placeholder `&` has every `&` replaced by the ancestor
///   text, with no combinator (`&:hover` under `.a` is `.a:hover`);
/// - any other child is joined to the ancestor with a descendant combinator
///   (`.b` under `.a` is `.a .b`).
///
/// An ancestor with several alternatives is folded into `:is(...)` first, so the result always
/// has one entry per child alternative and never the cross product.
public final class SelectorAlgebra {

    private static final Logger LOG = Logger.getLogger(SelectorAlgebra.class.getName());

    public static final char NESTING_PLACEHOLDER = '&';

    static final String GROUPING_OPEN = ":is(";
    static final String GROUPING_CLOSE = ")";

    private SelectorAlgebra() {}

    /// Combines an enclosing selector list with a nested one.
    /// @param ancestor the resolved selectors of the enclosing rule, or null at the top level
    /// @param child the selectors written on the nested rule
    /// @return `child` itself when there is no ancestor, otherwise one composed selector per child
    ///         alternative, in child order
    public static SelectorList combine(SelectorList ancestor, SelectorList child) {
        Objects.requireNonNull(child, "child must not be null");
        if (ancestor == null) {
            return child;
        }

        final var ancestorText = ancestorText(ancestor);
        final var childAlternatives = child.alternatives();
        final var out = new ArrayList<String>(childAlternatives.size());
        for (final var selector : childAlternatives) {
            out.add(compose(ancestorText, selector));
        }

        final var result = new SelectorList(out);
        LOG.finer(() -> "combine [" + ancestor.text() + "] with [" + child.text() + "] -> [" + result.text() + "]");
        return result;
    }

    /// The text that stands for `ancestor` inside a composed selector.
    static String ancestorText(SelectorList ancestor) {
        final var alternatives = ancestor.alternatives();
        if (alternatives.size() == 1) {
            return alternatives.get(0);
        }
        return GROUPING_OPEN + String.join(", ", alternatives) + GROUPING_CLOSE;
    }

    static boolean hasPlaceholder(String selector) {
        return selector.indexOf(NESTING_PLACEHOLDER) >= 0;
    }

    private static String compose(String ancestorText, String selector) {
        if (!hasPlaceholder(selector)) {
            return ancestorText + " " + selector;
        }
        final var sb = new StringBuilder(selector.length() + ancestorText.length());
        for (int i = 0; i < selector.length(); i++) {
            final char c = selector.charAt(i);
            if (c == NESTING_PLACEHOLDER) {
                sb.append(ancestorText);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
