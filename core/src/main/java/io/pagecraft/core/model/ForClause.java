package io.pagecraft.core.model;

import java.util.List;
import java.util.Objects;

/** One clause of a {@code for} directive: an iteration over a source or a filter. */
public sealed interface ForClause {

    /**
     * {@code for a, b in source}. Each value produced by the source is bound to the targets.
     *
     * @param targets identifiers in declaration order
     * @param source  expression producing the values
     */
    record Iteration(List<String> targets, String source) implements ForClause {

        public Iteration {
            targets = List.copyOf(targets);
            Objects.requireNonNull(source, "source must not be null");
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("an iteration needs at least one target");
            }
        }
    }

    /** {@code if condition}. Combinations for which the condition is falsy are skipped. */
    record Filter(String condition) implements ForClause {

        public Filter {
            Objects.requireNonNull(condition, "condition must not be null");
        }
    }
}
