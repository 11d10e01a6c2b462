package io.pagecraft.core.model;

import java.util.Objects;

/** Literal text copied verbatim to the output. */
public record TextNode(String content) implements Node {

    public TextNode {
        Objects.requireNonNull(content, "content must not be null");
    }

    public boolean isEmpty() {
        return content.isEmpty();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitText(this);
    }
}
