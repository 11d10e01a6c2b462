package io.pagecraft.core.engine;

import io.pagecraft.core.engine.jslt.JsltExpressionEvaluator;
import io.pagecraft.core.engine.spel.SpelExpressionEvaluator;
import io.pagecraft.core.spi.ExpressionEvaluator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for expression evaluators, keyed by {@link ExpressionEvaluator#id()}. Thread-safe:
 * registration and lookup can happen concurrently.
 */
public final class EvaluatorRegistry {

    private final Map<String, ExpressionEvaluator> evaluators = new ConcurrentHashMap<>();

    /** Returns a registry holding the bundled {@code spel} and {@code jslt} evaluators. */
    public static EvaluatorRegistry withDefaults() {
        EvaluatorRegistry registry = new EvaluatorRegistry();
        registry.register(new SpelExpressionEvaluator());
        registry.register(new JsltExpressionEvaluator());
        return registry;
    }

    /**
     * Registers an evaluator. An evaluator with the same id is replaced (last-write-wins).
     *
     * @throws NullPointerException if evaluator is null
     * @throws IllegalArgumentException if evaluator.id() is null or empty
     */
    public void register(ExpressionEvaluator evaluator) {
        if (evaluator == null) {
            throw new NullPointerException("evaluator must not be null");
        }
        String id = evaluator.id();
        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("evaluator id must not be null or empty");
        }
        evaluators.put(id, evaluator);
    }

    /** Looks up an evaluator by id. */
    public Optional<ExpressionEvaluator> getEvaluator(String id) {
        return Optional.ofNullable(evaluators.get(id));
    }

    /**
     * Looks up an evaluator by id, throwing if not found.
     *
     * @throws IllegalArgumentException if no evaluator is registered with the given id
     */
    public ExpressionEvaluator requireEvaluator(String id) {
        return getEvaluator(id)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No expression evaluator registered for id: '" + id + "' (available: " + ids() + ")"));
    }

    /** Registered ids, sorted. */
    public Set<String> ids() {
        return new TreeSet<>(evaluators.keySet());
    }

    public boolean hasEvaluator(String id) {
        return evaluators.containsKey(id);
    }
}
