package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/** Thrown when a {@code def} tag has no name or a name/parameter that is not an identifier. */
public final class InvalidFunctionDefinitionException extends TemplateSyntaxException {

    private static final long serialVersionUID = 1L;

    public InvalidFunctionDefinitionException(String body, Location location) {
        super(
                "Incorrect function definition at " + location + ": '" + body
                        + "'. Expected 'def <name> [<param> ...]' with valid identifiers.",
                location);
    }
}
