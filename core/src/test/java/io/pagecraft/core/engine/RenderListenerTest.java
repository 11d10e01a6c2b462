package io.pagecraft.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.pagecraft.core.engine.spel.SpelExpressionEvaluator;
import io.pagecraft.core.error.ExpressionEvalException;
import io.pagecraft.core.model.Location;
import io.pagecraft.core.model.Template;
import io.pagecraft.core.spi.RenderListener;
import io.pagecraft.core.spi.RenderListener.LoopTerminatedEvent;
import io.pagecraft.core.spi.RenderListener.RenderCompletedEvent;
import io.pagecraft.core.spi.RenderListener.RenderFailedEvent;
import io.pagecraft.core.spi.RenderListener.RenderStartedEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

/**
 * Verifies that a {@link RenderListener} receives the render lifecycle events and that a failing
 * listener never breaks a render.
 */
@DisplayName("RenderListenerTest")
class RenderListenerTest {

    private CapturingRenderListener listener;
    private TemplateEngine engine;

    private ListAppender<ILoggingEvent> logAppender;
    private Logger engineLogger;

    @BeforeEach
    void setUp() {
        listener = new CapturingRenderListener();
        engine = new TemplateEngine(new SpelExpressionEvaluator(), LoopBudget.ofMillis(20), listener);

        engineLogger = (Logger) LoggerFactory.getLogger(TemplateEngine.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        engineLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Successful render → started + completed events")
    void successfulRenderEmitsLifecycleEvents() {
        Template template = engine.parse("page.html", "Hello {{ name }}");

        engine.render(template, Map.of("name", "World"));

        assertThat(listener.startedEvents).containsExactly(new RenderStartedEvent("page.html"));
        assertThat(listener.completedEvents).singleElement().satisfies(event -> {
            assertThat(event.templateName()).isEqualTo("page.html");
            assertThat(event.outputLength()).isEqualTo("Hello World".length());
            assertThat(event.durationMs()).isNotNegative();
        });
        assertThat(listener.failedEvents).isEmpty();
    }

    @Test
    @DisplayName("Failed render → started + failed events, exception propagates")
    void failedRenderEmitsFailedEvent() {
        Template template = engine.parse("broken.html", "{{ undefined_name }}");

        assertThatThrownBy(() -> engine.render(template, Map.of())).isInstanceOf(ExpressionEvalException.class);

        assertThat(listener.startedEvents).hasSize(1);
        assertThat(listener.completedEvents).isEmpty();
        assertThat(listener.failedEvents).singleElement().satisfies(event -> {
            assertThat(event.templateName()).isEqualTo("broken.html");
            assertThat(event.errorDetail()).contains("undefined_name").contains("line 1, column 1");
        });
    }

    @Test
    @DisplayName("Terminated while loop → loop event, render still completes")
    void terminatedLoopEmitsEvent() {
        Template template = engine.parse("loop.html", "\n{% while true %}.{% endwhile %}");

        engine.render(template, Map.of());

        assertThat(listener.loopEvents).singleElement().satisfies(event -> {
            assertThat(event.templateName()).isEqualTo("loop.html");
            assertThat(event.expression()).isEqualTo("true");
            assertThat(event.location()).isEqualTo(new Location(2, 1));
            assertThat(event.iterations()).isPositive();
        });
        assertThat(listener.completedEvents).hasSize(1);
    }

    @Test
    @DisplayName("Throwing listener → render unaffected, failure logged")
    void throwingListenerIsIsolated() {
        var throwing = new TemplateEngine(new SpelExpressionEvaluator(), LoopBudget.DEFAULT, new ThrowingRenderListener());

        String output = throwing.render("ok {{ 1 + 1 }}", Map.of());

        assertThat(output).isEqualTo("ok 2");
        assertThat(logAppender.list)
                .filteredOn(event -> event.getLevel() == Level.WARN)
                .extracting(ILoggingEvent::getFormattedMessage)
                .containsExactly("RenderListener.onRenderStarted failed", "RenderListener.onRenderCompleted failed");
    }

    @Test
    void noListenerIsFine() {
        var silent = new TemplateEngine(new SpelExpressionEvaluator());

        assertThat(silent.render("x", Map.of())).isEqualTo("x");
        assertThat(listener.startedEvents).isEmpty();
    }

    private static class CapturingRenderListener implements RenderListener {
        final List<RenderStartedEvent> startedEvents = new ArrayList<>();
        final List<RenderCompletedEvent> completedEvents = new ArrayList<>();
        final List<RenderFailedEvent> failedEvents = new ArrayList<>();
        final List<LoopTerminatedEvent> loopEvents = new ArrayList<>();

        @Override
        public void onRenderStarted(RenderStartedEvent event) {
            startedEvents.add(event);
        }

        @Override
        public void onRenderCompleted(RenderCompletedEvent event) {
            completedEvents.add(event);
        }

        @Override
        public void onRenderFailed(RenderFailedEvent event) {
            failedEvents.add(event);
        }

        @Override
        public void onLoopTerminated(LoopTerminatedEvent event) {
            loopEvents.add(event);
        }
    }

    private static class ThrowingRenderListener implements RenderListener {

        @Override
        public void onRenderStarted(RenderStartedEvent event) {
            throw new IllegalStateException("listener bug");
        }

        @Override
        public void onRenderCompleted(RenderCompletedEvent event) {
            throw new IllegalStateException("listener bug");
        }

        @Override
        public void onRenderFailed(RenderFailedEvent event) {
            throw new IllegalStateException("listener bug");
        }

        @Override
        public void onLoopTerminated(LoopTerminatedEvent event) {
            throw new IllegalStateException("listener bug");
        }
    }
}
