package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when a {@code capture} tag does not name exactly one valid identifier. */
public final class InvalidCaptureNameException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public InvalidCaptureNameException(String variable, Location location) {
        super("Incorrect capture block at " + location + ": '" + variable + "' is not a valid variable name.", location);
    }
}
