package io.pagecraft.cli.config;

import java.util.Locale;
import java.util.Set;

/**
 * Configuration of the {@code pagecraft} command. Every field has a default; use
 * {@link #builder()} to override some of them.
 *
 * @param evaluator        id of the expression evaluator ({@code engine.evaluator})
 * @param whileTimeLimitMs time limit of {@code while} loops in ms ({@code engine.while-time-limit-ms})
 * @param loggingFormat    {@code text} or {@code json} ({@code logging.format})
 * @param loggingLevel     root log level ({@code logging.level})
 */
public record CliConfig(String evaluator, long whileTimeLimitMs, String loggingFormat, String loggingLevel) {

    static final Set<String> LOGGING_FORMATS = Set.of("text", "json");

    public CliConfig {
        if (evaluator == null || evaluator.isBlank()) {
            throw new IllegalArgumentException("engine.evaluator must not be empty");
        }
        if (whileTimeLimitMs <= 0) {
            throw new IllegalArgumentException(
                    "engine.while-time-limit-ms must be positive, got: " + whileTimeLimitMs);
        }
        if (loggingFormat == null || !LOGGING_FORMATS.contains(loggingFormat.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("logging.format must be 'text' or 'json', got: " + loggingFormat);
        }
    }

    /** Creates a new builder with the defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {
        private String evaluator = "spel";
        private long whileTimeLimitMs = 2000;
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        Builder() {}

        public Builder evaluator(String evaluator) {
            this.evaluator = evaluator;
            return this;
        }

        public Builder whileTimeLimitMs(long whileTimeLimitMs) {
            this.whileTimeLimitMs = whileTimeLimitMs;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(evaluator, whileTimeLimitMs, loggingFormat, loggingLevel);
        }
    }
}
