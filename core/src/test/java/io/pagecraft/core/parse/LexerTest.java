package io.pagecraft.core.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.pagecraft.core.error.IncompleteTagException;
import io.pagecraft.core.error.MultiLineBlockTagException;
import io.pagecraft.core.error.TemplateSyntaxException;
import io.pagecraft.core.error.UnknownTagException;
import io.pagecraft.core.model.BlockKind;
import io.pagecraft.core.model.BlockTag;
import io.pagecraft.core.model.CommentTag;
import io.pagecraft.core.model.ExprTag;
import io.pagecraft.core.model.Location;
import io.pagecraft.core.model.Node;
import io.pagecraft.core.model.TextNode;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Lexer")
class LexerTest {

    @Nested
    @DisplayName("Text")
    class Text {

        @Test
        void emptySourceProducesNoTokens() {
            assertThat(Lexer.lex("")).isEmpty();
        }

        @Test
        void singleCharacterIsKept() {
            assertThat(Lexer.lex("a")).containsExactly(new TextNode("a"));
        }

        @Test
        void plainTextIsOneNode() {
            assertThat(Lexer.lex("Hello,\nWorld {!}")).containsExactly(new TextNode("Hello,\nWorld {!}"));
        }

        @Test
        void loneBracesAreText() {
            assertThat(Lexer.lex("{ } %} }} #}")).containsExactly(new TextNode("{ } %} }} #}"));
        }

        @Test
        @DisplayName("\\{ and \\} produce literal braces that never open a tag")
        void escapedBracesAreLiteral() {
            assertThat(Lexer.lex("\\{{ x \\}}")).containsExactly(new TextNode("{{ x }}"));
        }

        @Test
        void backslashBeforeOtherCharactersIsKept() {
            assertThat(Lexer.lex("a\\nb")).containsExactly(new TextNode("a\\nb"));
        }
    }

    @Nested
    @DisplayName("Tags")
    class Tags {

        @Test
        void splitsTextAndExpression() {
            List<Node> tokens = Lexer.lex("Hello {{ name }}!");

            assertThat(tokens).hasSize(3);
            assertThat(tokens.get(0)).isEqualTo(new TextNode("Hello "));
            assertThat(tokens.get(1)).isInstanceOfSatisfying(ExprTag.class, expr -> {
                assertThat(expr.body()).isEqualTo(" name ");
                assertThat(expr.code().code()).isEqualTo("name");
                assertThat(expr.code().statements()).isFalse();
            });
            assertThat(tokens.get(2)).isEqualTo(new TextNode("!"));
        }

        @Test
        void escapesInsideExpressionBodiesAreApplied() {
            List<Node> tokens = Lexer.lex("{{ '\\{' }}");

            assertThat(tokens).singleElement().isInstanceOfSatisfying(ExprTag.class, expr ->
                    assertThat(expr.body()).isEqualTo(" '{' "));
        }

        @Test
        void blockTagsAreClassifiedAndTrimmed() {
            List<Node> tokens = Lexer.lex("{%   if x   %}");

            assertThat(tokens).singleElement().isInstanceOfSatisfying(BlockTag.class, block -> {
                assertThat(block.body()).isEqualTo("if x");
                assertThat(block.kind()).isEqualTo(new BlockKind.Conditional("if", "x"));
                assertThat(block.children()).isEmpty();
            });
        }

        @Test
        void adjacentTagsProduceNoEmptyText() {
            List<Node> tokens = Lexer.lex("{{ a }}{{ b }}");

            assertThat(tokens).hasSize(2).allMatch(ExprTag.class::isInstance);
        }

        @Test
        void expressionBodyMayContainBlockDelimiters() {
            List<Node> tokens = Lexer.lex("{{ '{%' }}");

            assertThat(tokens).singleElement().isInstanceOfSatisfying(ExprTag.class, expr ->
                    assertThat(expr.body()).isEqualTo(" '{%' "));
        }

        @Test
        void unknownBlockKeywordIsRejectedWhileLexing() {
            assertThatThrownBy(() -> Lexer.lex("text {% frobnicate %}"))
                    .isInstanceOf(UnknownTagException.class)
                    .hasMessageContaining("frobnicate");
        }
    }

    @Nested
    @DisplayName("Comments")
    class Comments {

        @Test
        void commentBodyIsKeptVerbatim() {
            assertThat(Lexer.lex("{# note #}")).containsExactly(new CommentTag(" note ", new Location(1, 1)));
        }

        @Test
        void commentsNest() {
            List<Node> tokens = Lexer.lex("a{# x {# y #} z #}b");

            assertThat(tokens).containsExactly(
                    new TextNode("a"), new CommentTag(" x {# y #} z ", new Location(1, 2)), new TextNode("b"));
        }

        @Test
        void otherDelimitersInsideCommentsAreInert() {
            List<Node> tokens = Lexer.lex("{# {{ x }} {% if %} #}");

            assertThat(tokens).singleElement().isInstanceOfSatisfying(CommentTag.class, comment ->
                    assertThat(comment.body()).isEqualTo(" {{ x }} {% if %} "));
        }

        @Test
        void escapesAreNotAppliedInsideComments() {
            List<Node> tokens = Lexer.lex("{# \\{ #}");

            assertThat(tokens).singleElement().isInstanceOfSatisfying(CommentTag.class, comment ->
                    assertThat(comment.body()).isEqualTo(" \\{ "));
        }

        @Test
        void unbalancedNestedCommentIsIncomplete() {
            assertThatThrownBy(() -> Lexer.lex("{# outer {# inner #}"))
                    .isInstanceOf(IncompleteTagException.class)
                    .hasMessage("Missing closing '#}' for opening '{#' at line 1, column 1.");
        }
    }

    @Nested
    @DisplayName("Locations")
    class Locations {

        @Test
        void locationsAreOneBased() {
            List<Node> tokens = Lexer.lex("ab\n  {{ x }}\n{% if y %}");

            assertThat(((ExprTag) tokens.get(1)).location()).isEqualTo(new Location(2, 3));
            assertThat(((BlockTag) tokens.get(3)).location()).isEqualTo(new Location(3, 1));
        }

        @Test
        void escapesCountTwoColumns() {
            List<Node> tokens = Lexer.lex("\\{{{ x }}");

            assertThat(tokens.get(0)).isEqualTo(new TextNode("{"));
            assertThat(((ExprTag) tokens.get(1)).location()).isEqualTo(new Location(1, 3));
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void unterminatedExpressionIsIncomplete() {
            assertThatThrownBy(() -> Lexer.lex("Hello {{ name"))
                    .isInstanceOf(IncompleteTagException.class)
                    .hasMessage("Missing closing '}}' for opening '{{' at line 1, column 7.");
        }

        @Test
        void unterminatedBlockIsIncomplete() {
            assertThatThrownBy(() -> Lexer.lex("\n{% if x"))
                    .isInstanceOfSatisfying(IncompleteTagException.class, e ->
                            assertThat(e.location()).isEqualTo(new Location(2, 1)));
        }

        @Test
        void blockTagsMustFitOnOneLine() {
            assertThatThrownBy(() -> Lexer.lex("{% if\n x %}"))
                    .isInstanceOf(MultiLineBlockTagException.class)
                    .isInstanceOf(TemplateSyntaxException.class)
                    .hasMessageContaining("line 1, column 1");
        }
    }
}
