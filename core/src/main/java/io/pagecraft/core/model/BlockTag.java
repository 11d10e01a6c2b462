package io.pagecraft.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A {@code {% ... %}} block tag.
 *
 * <p>The lexer creates block tags with no children once the directive has been classified; the
 * tree builder re-creates them with their children (and, for conditionals, their {@code elif} /
 * {@code else} continuation) attached. Children are owned exclusively by this block.
 *
 * @param kind         classified directive
 * @param body         directive text between the delimiters, trimmed
 * @param location     position of the opening delimiter
 * @param children     nested nodes up to the matching end tag (or the next continuation)
 * @param continuation the next {@code elif}/{@code else} block of a conditional chain, or {@code null}
 */
public record BlockTag(BlockKind kind, String body, Location location, List<Node> children, BlockTag continuation)
        implements Node {

    public BlockTag {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(location, "location must not be null");
        children = List.copyOf(children);
        if (continuation != null && !(kind instanceof BlockKind.Conditional)) {
            throw new IllegalArgumentException("only conditional blocks carry a continuation: " + body);
        }
    }

    /** Creates a childless block tag as emitted by the lexer. */
    public static BlockTag of(BlockKind kind, String body, Location location) {
        return new BlockTag(kind, body, location, List.of(), null);
    }

    /** Returns a copy of this block with the given children and continuation attached. */
    public BlockTag withChildren(List<Node> newChildren, BlockTag newContinuation) {
        return new BlockTag(kind, body, location, newChildren, newContinuation);
    }

    public boolean hasContinuation() {
        return continuation != null;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBlock(this);
    }
}
