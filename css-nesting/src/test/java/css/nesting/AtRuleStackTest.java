package css.nesting;

import css.nesting.CssAst.AtRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AtRuleStackTest extends CssNestingTestBase {

    @Test
    void pushLeavesReceiverUntouched() {
        final var base = AtRuleStack.empty().push(at("layer", "thing"));
        final var left = base.push(at("media", "(min-width: 600px)"));
        final var right = base.push(at("supports", "(color: green)"));

        assertThat(base.depth()).isEqualTo(1);
        assertThat(left.shells()).extracting(AtRule::name).containsExactly("layer", "media");
        assertThat(right.shells()).extracting(AtRule::name).containsExactly("layer", "supports");
    }

    @Test
    void pushKeepsOnlyTheShell() {
        final var stack = AtRuleStack.empty().push(at("media", "print", decl("color", "red")));
        assertThat(stack.shells()).containsExactly(at("media", "print"));
    }

    @Test
    void wrapOnEmptyStackReturnsContent() {
        final var content = List.<CssAst.Node>of(decl("color", "red"), decl("color", "blue"));
        assertThat(AtRuleStack.empty().isEmpty()).isTrue();
        assertThat(AtRuleStack.empty().wrap(content)).isEqualTo(content);
    }

    @Test
    void wrapBuildsOutermostFirst() {
        final var stack = AtRuleStack.empty()
                .push(at("layer", "thing"))
                .push(at("media", "(min-width: 600px)"));
        final var wrapped = stack.wrap(List.of(rule(".c", decl("color", "yellow"))));

        assertThat(wrapped).containsExactly(
                at("layer", "thing",
                        at("media", "(min-width: 600px)",
                                rule(".c", decl("color", "yellow")))));
    }

    @Test
    void wrapBuildsNewShellsEachTime() {
        final var stack = AtRuleStack.empty().push(at("layer", "thing"));
        final var first = stack.wrap(List.of(decl("a", "1")));
        final var second = stack.wrap(List.of(decl("a", "1")));

        assertThat(first).isEqualTo(second);
        assertThat(first.get(0)).isNotSameAs(second.get(0));
        assertThat(stack.shells().get(0).children()).isEmpty();
    }

    @Test
    void toStringShowsChain() {
        final var stack = AtRuleStack.empty().push(at("layer", "")).push(at("media", "print"));
        assertThat(stack).hasToString("[@layer > @media print]");
    }
}
