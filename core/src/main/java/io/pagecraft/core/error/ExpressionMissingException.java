package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when an {@code if}, {@code elif} or {@code while} tag has no condition. */
public final class ExpressionMissingException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public ExpressionMissingException(String keyword, Location location) {
        super("Expression missing in `" + keyword + "` tag at " + location + ".", location);
    }
}
