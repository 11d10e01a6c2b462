package io.pagecraft.core.spi;

/**
 * Pluggable expression language SPI. The core never interprets the code inside tags itself; it
 * hands expressions, statement blocks and loop sources to an evaluator together with the
 * environment of the current render.
 *
 * <p>Implementations MUST be stateless and thread-safe. All per-render state lives in the
 * {@link Environment}.
 */
public interface ExpressionEvaluator {

    /**
     * Returns the evaluator identifier, e.g. {@code "spel"} or {@code "jslt"}. Used by the CLI's
     * {@code --evaluator} option and the {@code engine.evaluator} configuration key.
     *
     * @return a non-null, non-empty identifier (lowercase, no spaces)
     */
    String id();

    /**
     * Evaluates a single expression against the environment.
     *
     * @return the value, possibly {@code null}
     * @throws io.pagecraft.core.error.ExpressionEvalException if evaluation fails
     */
    Object evaluate(String expression, Environment env);

    /**
     * Evaluates a condition. The default applies the shared {@link Truthiness} policy to the result
     * of {@link #evaluate(String, Environment)}.
     */
    default boolean test(String expression, Environment env) {
        return Truthiness.isTruthy(evaluate(expression, env));
    }

    /**
     * Executes a block of statements for its side effects.
     *
     * @return the text the code produced through the {@code write} channel, empty if none
     * @throws io.pagecraft.core.error.ExpressionEvalException if execution fails
     */
    String execute(String code, Environment env);

    /**
     * Evaluates {@code expression} and returns a lazy sequence over its elements, for use as a
     * {@code for} loop source.
     *
     * @throws io.pagecraft.core.error.ExpressionEvalException if evaluation fails or the value is
     *     not iterable
     */
    LazySequence sequence(String expression, Environment env);
}
