package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when an {@code else} tag carries trailing text. */
public final class ExpressionProhibitedException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public ExpressionProhibitedException(String keyword, Location location) {
        super(
                "The `" + keyword + "` tag at " + location + " must appear by itself without any text next to it.",
                location);
    }
}
