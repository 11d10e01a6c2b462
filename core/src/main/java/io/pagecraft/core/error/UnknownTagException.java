package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when a block tag's directive does not match any known block kind. */
public final class UnknownTagException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public UnknownTagException(String body, Location location) {
        super("Unknown tag '{% " + body + " %}' at " + location + ".", location);
    }
}
