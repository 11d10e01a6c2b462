package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when a {@code {% ... %}} tag spans more than one line. */
public final class MultiLineBlockTagException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public MultiLineBlockTagException(Location location) {
        super(
                "The tag starting at " + location + " spans multiple lines. Block tags ('{% ... %}') must be on one line.",
                location);
    }
}
