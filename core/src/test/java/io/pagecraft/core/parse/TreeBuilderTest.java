package io.pagecraft.core.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pagecraft.core.error.ElifOrElseWithoutIfException;
import io.pagecraft.core.error.MismatchingEndTagException;
import io.pagecraft.core.error.TemplateException;
import io.pagecraft.core.error.UnboundEndTagException;
import io.pagecraft.core.error.UnclosedTagException;
import io.pagecraft.core.model.BlockKind;
import io.pagecraft.core.model.BlockTag;
import io.pagecraft.core.model.Location;
import io.pagecraft.core.model.Template;
import io.pagecraft.core.model.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TreeBuilder")
class TreeBuilderTest {

    private static Template parse(String source) {
        return TemplateParser.parse("test.tpl", source);
    }

    @Nested
    @DisplayName("Nesting")
    class Nesting {

        @Test
        void flatTemplate() {
            Template template = parse("Hello {{ name }}");

            assertThat(template.name()).isEqualTo("test.tpl");
            assertThat(template.children()).hasSize(2);
        }

        @Test
        void blockOwnsItsChildren() {
            Template template = parse("a{% for x in xs %}b{{ x }}{% endfor %}c");

            assertThat(template.children()).hasSize(3);
            BlockTag loop = (BlockTag) template.children().get(1);
            assertThat(loop.kind()).isInstanceOf(BlockKind.ForLoop.class);
            assertThat(loop.children()).hasSize(2);
            assertThat(loop.children().get(0)).isEqualTo(new TextNode("b"));
            assertThat(template.children().get(2)).isEqualTo(new TextNode("c"));
        }

        @Test
        void blocksNest() {
            Template template = parse("{% for x in xs %}{% if x %}{% capture y %}z{% endcapture %}{% endif %}{% endfor %}");

            BlockTag loop = (BlockTag) template.children().get(0);
            BlockTag conditional = (BlockTag) loop.children().get(0);
            BlockTag capture = (BlockTag) conditional.children().get(0);
            assertThat(capture.kind()).isEqualTo(new BlockKind.Capture("y"));
            assertThat(capture.children()).containsExactly(new TextNode("z"));
        }

        @Test
        void bareEndClosesTheInnermostBlock() {
            Template template = parse("{% while x %}{% if y %}a{% end %}b{% %}");

            BlockTag loop = (BlockTag) template.children().get(0);
            assertThat(loop.children()).hasSize(2);
            assertThat(loop.children().get(1)).isEqualTo(new TextNode("b"));
        }

        @Test
        void endTagsAreNotPartOfTheTree() {
            Template template = parse("{% comment %}x{% endcomment %}");

            BlockTag comment = (BlockTag) template.children().get(0);
            assertThat(comment.children()).containsExactly(new TextNode("x"));
            assertThat(template.children()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Conditional chains")
    class Chains {

        @Test
        @DisplayName("if/elif/else → continuation chain closed by a single endif")
        void chainIsLinkedThroughContinuations() {
            Template template = parse("{% if a %}1{% elif b %}2{% else %}3{% endif %}");

            assertThat(template.children()).hasSize(1);
            BlockTag first = (BlockTag) template.children().get(0);
            assertThat(first.children()).containsExactly(new TextNode("1"));

            BlockTag second = first.continuation();
            assertThat(second.kind()).isEqualTo(new BlockKind.Conditional("elif", "b"));
            assertThat(second.children()).containsExactly(new TextNode("2"));

            BlockTag third = second.continuation();
            assertThat(third.kind()).isEqualTo(BlockKind.Conditional.otherwise());
            assertThat(third.children()).containsExactly(new TextNode("3"));
            assertThat(third.hasContinuation()).isFalse();
        }

        @Test
        void chainsNestInsideBranches() {
            Template template = parse("{% if a %}{% if b %}x{% else %}y{% endif %}{% else %}z{% endif %}");

            BlockTag outer = (BlockTag) template.children().get(0);
            BlockTag inner = (BlockTag) outer.children().get(0);
            assertThat(inner.continuation().children()).containsExactly(new TextNode("y"));
            assertThat(outer.continuation().children()).containsExactly(new TextNode("z"));
        }

        @Test
        void elseWithoutIf() {
            assertThatThrownBy(() -> parse("a\n{% else %}b"))
                    .isInstanceOf(ElifOrElseWithoutIfException.class)
                    .hasMessage("Missing initial `if` tag for conditional `else` tag at line 2, column 1.");
        }

        @Test
        void elifInsideALoop() {
            assertThatThrownBy(() -> parse("{% for x in xs %}{% elif y %}{% endfor %}"))
                    .isInstanceOf(ElifOrElseWithoutIfException.class);
        }

        @Test
        @DisplayName("Nothing may follow an else branch")
        void branchAfterElse() {
            assertThatThrownBy(() -> parse("{% if a %}{% else %}{% elif b %}{% endif %}"))
                    .isInstanceOf(ElifOrElseWithoutIfException.class)
                    .hasMessageContaining("`elif`");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void unclosedBlock() {
            assertThatThrownBy(() -> parse("{% if true %}body"))
                    .isInstanceOfSatisfying(UnclosedTagException.class, e -> {
                        assertThat(e.getMessage())
                                .isEqualTo("Missing closing '{% endif %}' tag for opening '{% if true %}' at line 1,"
                                        + " column 1.");
                        assertThat(e.phase()).isEqualTo(TemplateException.Phase.PARSE);
                    });
        }

        @Test
        void unclosedElseReportsTheElse() {
            assertThatThrownBy(() -> parse("{% if a %}x\n{% else %}y"))
                    .isInstanceOfSatisfying(UnclosedTagException.class, e ->
                            assertThat(e.location()).isEqualTo(new Location(2, 1)));
        }

        @Test
        void unboundEnd() {
            assertThatThrownBy(() -> parse("text{% endfor %}"))
                    .isInstanceOf(UnboundEndTagException.class)
                    .hasMessage("Unbound closing tag '{% endfor %}' at line 1, column 5.");
        }

        @Test
        void mismatchingEnd() {
            assertThatThrownBy(() -> parse("{% for x in xs %}\n{% endwhile %}"))
                    .isInstanceOfSatisfying(MismatchingEndTagException.class, e -> {
                        assertThat(e.location()).isEqualTo(new Location(2, 1));
                        assertThat(e.blockLocation()).isEqualTo(new Location(1, 1));
                        assertThat(e.getMessage())
                                .isEqualTo("The end tag '{% endwhile %}' at line 2, column 1 should be '{% endfor %}',"
                                        + " as it corresponds to the block tag '{% for x in xs %}' at line 1,"
                                        + " column 1.");
                    });
        }

        @Test
        void endifClosingAnElseChainIsAccepted() {
            assertThat(parse("{% if a %}{% else %}{% endif %}").children()).hasSize(1);
        }

        @Test
        void endelseIsNotAValidCloser() {
            assertThatThrownBy(() -> parse("{% if a %}{% else %}{% endelse %}"))
                    .isInstanceOf(MismatchingEndTagException.class);
        }
    }
}
