package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/**
 * Abstract parent for parse-time errors. Raised by the lexer, block classifier and tree builder
 * before any output is produced. Every syntax error points at the construct that caused it.
 */
public abstract class TemplateSyntaxException extends TemplateException {

    private static final long serialVersionUID = 1L;

    private final Location location;

    protected TemplateSyntaxException(String message, Location location) {
        super(message, Phase.PARSE);
        this.location = location;
    }

    /** Position of the offending construct. */
    public Location location() {
        return location;
    }
}
