package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when a {@code for} directive has no loop targets or no {@code in} clause. */
public final class IncorrectForTagException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public IncorrectForTagException(String body, String reason, Location location) {
        super("Incorrect `for` tag syntax at " + location + ": '" + body + "' (" + reason + ").", location);
    }
}
