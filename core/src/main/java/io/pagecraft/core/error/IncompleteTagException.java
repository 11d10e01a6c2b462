package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when the input ends while a tag is still open. */
public final class IncompleteTagException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public IncompleteTagException(String openDelimiter, String closeDelimiter, Location location) {
        super(
                "Missing closing '" + closeDelimiter + "' for opening '" + openDelimiter + "' at " + location + ".",
                location);
    }
}
