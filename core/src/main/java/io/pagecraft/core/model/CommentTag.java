package io.pagecraft.core.model;

import java.util.Objects;

/**
 * A {@code {# ... #}} comment. The body keeps nested comment delimiters verbatim and never reaches
 * the output.
 */
public record CommentTag(String body, Location location) implements Node {

    public CommentTag {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitComment(this);
    }
}
