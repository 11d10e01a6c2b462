package io.pagecraft.core.error;

import io.pagecraft.core.model.Location;

/**
 * Thrown when an expression evaluator fails (undefined name, type error, exception raised by the
 * evaluated code). Evaluators raise it without a location; the executor attaches the tag location
 * through {@link #at(Location)}.
 */
public final class ExpressionEvalException extends TemplateEvalException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    public ExpressionEvalException(String message, String expression) {
        this(message, null, expression, null);
    }

    public ExpressionEvalException(String message, Throwable cause, String expression) {
        this(message, cause, expression, null);
    }

    private ExpressionEvalException(String message, Throwable cause, String expression, Location location) {
        super(message, cause, location);
        this.expression = expression;
    }

    /** The expression or code that failed. */
    public String expression() {
        return expression;
    }

    /**
     * Returns this exception if it already carries a location, otherwise a copy located at the
     * given position.
     */
    public ExpressionEvalException at(Location tagLocation) {
        if (location() != null || tagLocation == null) {
            return this;
        }
        String located = getMessage() + " (at " + tagLocation + ")";
        ExpressionEvalException copy = new ExpressionEvalException(located, getCause(), expression, tagLocation);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
