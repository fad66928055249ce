package css.nesting;

import css.nesting.CssAst.Declaration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CssPrinterTest extends CssNestingTestBase {

    @Test
    void printsNestedBlocksWithTwoSpaceIndent() {
        final var css = CssPrinter.print(List.of(
                rule(".a", decl("color", "red")),
                at("layer", "thing",
                        at("media", "(min-width: 600px)", rule(".a .b", decl("color", "yellow"))))));

        assertThat(css).isEqualTo("""
                .a {
                  color: red;
                }
                @layer thing {
                  @media (min-width: 600px) {
                    .a .b {
                      color: yellow;
                    }
                  }
                }
                """);
    }

    @Test
    void printsSelectorListsMarkersAndImportant() {
        final var css = CssPrinter.print(List.of(
                rule(".a, .b", new Declaration("color", "red", true), slot()),
                slot()));

        assertThat(css).isEqualTo("""
                .a, .b {
                  color: red !important;
                  @slot;
                }
                @slot;
                """);
    }

    @Test
    void atRuleWithoutPreludeHasNoTrailingSpace() {
        assertThat(CssPrinter.print(at("font-face", "", decl("font-family", "Inter"))))
                .isEqualTo("@font-face {\n  font-family: Inter;\n}\n");
    }

    @Test
    void emptyRulePrintsEmptyBlock() {
        assertThat(CssPrinter.print(rule(".a"))).isEqualTo(".a {\n}\n");
    }

    @Test
    void printedOutputParsesBackToTheSameTree() {
        final var tree = List.<CssAst.Node>of(
                rule(".a", decl("color", "red"), rule("&:hover", decl("color", "blue"))),
                at("media", "print", rule(".b", slot())));

        assertThat(CssParser.parse(CssPrinter.print(tree))).isEqualTo(tree);
    }
}
