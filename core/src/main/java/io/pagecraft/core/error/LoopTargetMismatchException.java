package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;
import java.util.List;

/** Thrown when a value produced for a multi-target {@code for} clause cannot be unpacked into its targets. */
public final class LoopTargetMismatchException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    public LoopTargetMismatchException(List<String> targets, String actual, Location location) {
        super("Cannot unpack " + actual + " into loop targets " + targets + at(location), location);
    }

    private static String at(Location location) {
        return location == null ? "" : " (at " + location + ")";
    }
}
