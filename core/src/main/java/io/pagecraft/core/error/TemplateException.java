package io.pagecraft.core.error;

/**
 * Abstract base for all pagecraft exceptions. Never thrown directly; use the concrete subclasses
 * under {@link TemplateSyntaxException} or {@link TemplateEvalException}.
 */
public abstract class TemplateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        RENDER
    }

    private final Phase phase;

    protected TemplateException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected TemplateException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
