package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when the template ends while a block is still open. */
public final class UnclosedTagException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public UnclosedTagException(String keyword, String body, Location location) {
        super(
                "Missing closing '{% end" + keyword + " %}' tag for opening '{% " + body + " %}' at " + location + ".",
                location);
    }
}
