package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when an end tag appears with no open block to close. */
public final class UnboundEndTagException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public UnboundEndTagException(String body, Location location) {
        super("Unbound closing tag '{% " + body + " %}' at " + location + ".", location);
    }
}
