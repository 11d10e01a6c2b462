package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when an {@code elif} or {@code else} tag does not directly continue an {@code if}/{@code elif}. */
public final class ElifOrElseWithoutIfException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public ElifOrElseWithoutIfException(String branch, Location location) {
        super("Missing initial `if` tag for conditional `" + branch + "` tag at " + location + ".", location);
    }
}
