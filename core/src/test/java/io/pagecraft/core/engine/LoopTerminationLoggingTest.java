package io.pagecraft.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.pagecraft.core.engine.spel.SpelExpressionEvaluator;
import io.pagecraft.core.error.ExpressionEvalException;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * A {@code while} loop cut short by its time limit logs a WARN entry carrying the loop location and
 * the template name in the MDC.
 */
@DisplayName("LoopTerminationLoggingTest")
class LoopTerminationLoggingTest {

    private TemplateEngine engine;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger executorLogger;

    @BeforeEach
    void setUp() {
        engine = new TemplateEngine(new SpelExpressionEvaluator(), LoopBudget.ofMillis(20));

        executorLogger = (Logger) LoggerFactory.getLogger(TemplateExecutor.class);
        // snapshot the MDC while the render is still running
        logAppender = new ListAppender<>() {
            @Override
            protected void append(ILoggingEvent event) {
                event.prepareForDeferredProcessing();
                super.append(event);
            }
        };
        logAppender.start();
        executorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        executorLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Terminated loop → WARN with expression, location and limit")
    void terminatedLoopLogsWarning() {
        engine.render(engine.parse("spin.txt", "a\n{% while 1 == 1 %}x{% endwhile %}"), Map.of());

        assertThat(logAppender.list).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getFormattedMessage())
                    .startsWith("Loop '1 == 1' at line 2, column 1 terminated after ")
                    .endsWith("iterations: exceeded time limit of 20 ms");
            assertThat(event.getMDCPropertyMap()).containsEntry(TemplateEngine.MDC_TEMPLATE, "spin.txt");
        });
    }

    @Test
    @DisplayName("Finite loop → no log entry")
    void finiteLoopLogsNothing() {
        engine.render("{{ i = 0; }}{% while i < 5 %}{{ i = i + 1; }}{% endwhile %}", Map.of());

        assertThat(logAppender.list).isEmpty();
    }

    @Test
    @DisplayName("MDC is cleared after both successful and failed renders")
    void mdcIsCleared() {
        engine.render("ok", Map.of());
        assertThat(MDC.get(TemplateEngine.MDC_TEMPLATE)).isNull();

        assertThatThrownBy(() -> engine.render("{{ missing }}", Map.of())).isInstanceOf(ExpressionEvalException.class);
        assertThat(MDC.get(TemplateEngine.MDC_TEMPLATE)).isNull();
    }
}
