package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/**
 * Thrown when a line of a multi-line expression tag does not start with the indentation of the
 * tag's second line. Line numbers are absolute positions in the template.
 */
public final class MismatchingIndentationException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public MismatchingIndentationException(
            int line, String code, int referenceLine, String indentation, Location location) {
        super(
                "Mismatching indentation in line " + line + ": '" + code
                        + "'. Indentation must match the second line of code in the tag (i.e. line " + referenceLine
                        + "). The expected minimum indentation is: '" + indentation + "' (" + indentation.length()
                        + " characters).",
                location);
        this.line = line;
    }

    /** Absolute line number of the offending line. */
    public int line() {
        return line;
    }
}
