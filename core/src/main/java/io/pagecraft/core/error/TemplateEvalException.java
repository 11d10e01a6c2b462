package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/**
 * Abstract parent for render-time errors. Any of these aborts the render; no partial output is
 * returned. Carries the location of the tag being executed when it is known.
 */
public abstract class TemplateEvalException extends TemplateException {

    private static final long serialVersionUID = 1L;

    private final Location location;

    protected TemplateEvalException(String message, Location location) {
        super(message, Phase.RENDER);
        this.location = location;
    }

    protected TemplateEvalException(String message, Throwable cause, Location location) {
        super(message, cause, Phase.RENDER);
        this.location = location;
    }

    /** Position of the tag being executed, or {@code null} if not known. */
    public Location location() {
        return location;
    }
}
