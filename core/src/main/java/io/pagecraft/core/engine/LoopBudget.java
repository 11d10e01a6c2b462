package io.pagecraft.core.engine;

import java.time.Duration;

/**
 * Wall-clock limit for {@code while} loops not marked {@code slow}. Measured from the start of
 * each loop and checked once per iteration; an iteration that blocks is not interrupted.
 *
 * <p>Immutable and thread-safe.
 *
 * @param whileTimeLimit maximum time a single loop may run (default: 2 seconds)
 */
public record LoopBudget(Duration whileTimeLimit) {

    /** Default budget: 2 seconds per loop. */
    public static final LoopBudget DEFAULT = new LoopBudget(Duration.ofSeconds(2));

    public LoopBudget {
        if (whileTimeLimit == null || whileTimeLimit.isNegative() || whileTimeLimit.isZero()) {
            throw new IllegalArgumentException("whileTimeLimit must be positive, got: " + whileTimeLimit);
        }
    }

    public static LoopBudget ofMillis(long millis) {
        return new LoopBudget(Duration.ofMillis(millis));
    }
}
