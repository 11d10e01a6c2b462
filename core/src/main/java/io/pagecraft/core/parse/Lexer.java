package io.pagecraft.core.parse;

import io.pagecraft.core.error.IncompleteTagException;
import io.pagecraft.core.error.MultiLineBlockTagException;
import io.pagecraft.core.model.BlockTag;
import io.pagecraft.core.model.CommentTag;
import io.pagecraft.core.model.ExprTag;
import io.pagecraft.core.model.Location;
import io.pagecraft.core.model.Node;
import io.pagecraft.core.model.TextNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Character-level scanner turning template source into a flat list of nodes.
 *
 * <p>The scanner looks at two characters at a time. Outside comments, {@code \{} and
 * {@code \}} produce a literal brace and never start or end a tag. Comments nest: inside a
 * comment every {@code {#} must be matched by a {@code #}} before the comment ends, and the
 * nested delimiters stay in the comment body. Block tags are classified as soon as they close.
 */
public final class Lexer {

    /** The kinds of delimited tags, with their delimiters. */
    enum TagType {
        EXPR("{{", "}}"),
        BLOCK("{%", "%}"),
        COMMENT("{#", "#}");

        private final String open;
        private final String close;

        TagType(String open, String close) {
            this.open = open;
            this.close = close;
        }

        static TagType opening(String pair) {
            for (TagType type : values()) {
                if (type.open.equals(pair)) {
                    return type;
                }
            }
            return null;
        }
    }

    private final String source;
    private final List<Node> tokens = new ArrayList<>();
    private final StringBuilder buffer = new StringBuilder();

    private int pos;
    private int line = 1;
    private int column = 1;

    // null while scanning text (or before anything has been read)
    private TagType tag;
    private Location tagStart;
    private int commentDepth;

    private Lexer(String source) {
        this.source = source;
    }

    /**
     * Splits {@code source} into text, expression, comment and (classified, childless) block
     * nodes, in document order.
     *
     * @throws io.pagecraft.core.error.TemplateSyntaxException if a tag is malformed or unterminated
     */
    public static List<Node> lex(String source) {
        Lexer lexer = new Lexer(source);
        lexer.run();
        return lexer.tokens;
    }

    private void run() {
        while (pos < source.length()) {
            String pair = pos + 1 < source.length() ? source.substring(pos, pos + 2) : "";

            if (tag == null) {
                TagType opened = TagType.opening(pair);
                if (opened != null) {
                    flushText();
                    openTag(opened);
                    continue;
                }
            } else if (tag == TagType.COMMENT) {
                if (pair.equals(TagType.COMMENT.open)) {
                    commentDepth++;
                    consume(2, pair);
                    continue;
                }
                if (pair.equals(TagType.COMMENT.close)) {
                    commentDepth--;
                    if (commentDepth == 0) {
                        advance(2);
                        closeTag();
                    } else {
                        consume(2, pair);
                    }
                    continue;
                }
            } else if (pair.equals(tag.close)) {
                advance(2);
                closeTag();
                continue;
            }

            if (tag != TagType.COMMENT && (pair.equals("\\{") || pair.equals("\\}"))) {
                consume(2, pair.substring(1));
                continue;
            }
            consume(1, source.substring(pos, pos + 1));
        }

        if (tag != null) {
            throw new IncompleteTagException(tag.open, tag.close, tagStart);
        }
        flushText();
    }

    private void openTag(TagType type) {
        tag = type;
        tagStart = new Location(line, column);
        commentDepth = type == TagType.COMMENT ? 1 : 0;
        advance(2);
    }

    private void closeTag() {
        String body = buffer.toString();
        buffer.setLength(0);
        switch (tag) {
            case EXPR -> tokens.add(new ExprTag(body, tagStart, CodeFragmentParser.parse(body, tagStart)));
            case COMMENT -> tokens.add(new CommentTag(body, tagStart));
            case BLOCK -> {
                if (body.indexOf('\n') >= 0) {
                    throw new MultiLineBlockTagException(tagStart);
                }
                tokens.add(BlockTag.of(BlockClassifier.classify(body, tagStart), body.strip(), tagStart));
            }
        }
        tag = null;
        tagStart = null;
    }

    private void flushText() {
        if (buffer.length() > 0) {
            tokens.add(new TextNode(buffer.toString()));
            buffer.setLength(0);
        }
    }

    /** Appends {@code text} to the current node and moves past {@code count} source characters. */
    private void consume(int count, String text) {
        buffer.append(text);
        advance(count);
    }

    private void advance(int count) {
        for (int i = 0; i < count; i++) {
            if (source.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }
}
