package io.pagecraft.core.engine;

import io.pagecraft.core.error.TemplateException;
import io.pagecraft.core.model.Template;
import io.pagecraft.core.parse.TemplateParser;
import io.pagecraft.core.spi.Environment;
import io.pagecraft.core.spi.ExpressionEvaluator;
import io.pagecraft.core.spi.RenderListener;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Entry point of the library: parses templates and renders them with one expression evaluator.
 *
 * <p>Immutable and thread-safe. Each render gets its own {@link TemplateExecutor} and, unless the
 * caller passes one, its own {@link Environment}. Parsed {@link Template}s can be rendered any
 * number of times.
 *
 * <pre>{@code
 * TemplateEngine engine = new TemplateEngine(new SpelExpressionEvaluator());
 * String page = engine.render("Hello {{ name }}!", Map.of("name", "World"));
 * }</pre>
 */
public final class TemplateEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateEngine.class);

    /** MDC key holding the name of the template being rendered. */
    public static final String MDC_TEMPLATE = "template";

    private final ExpressionEvaluator evaluator;
    private final LoopBudget loopBudget;
    private final RenderListener listener;

    /** Creates an engine with the default loop budget and no listener. */
    public TemplateEngine(ExpressionEvaluator evaluator) {
        this(evaluator, LoopBudget.DEFAULT, null);
    }

    public TemplateEngine(ExpressionEvaluator evaluator, LoopBudget loopBudget) {
        this(evaluator, loopBudget, null);
    }

    /**
     * @param evaluator  expression evaluator used for every tag
     * @param loopBudget time limit for {@code while} loops
     * @param listener   optional listener for render lifecycle events, may be {@code null}
     */
    public TemplateEngine(ExpressionEvaluator evaluator, LoopBudget loopBudget, RenderListener listener) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.loopBudget = Objects.requireNonNull(loopBudget, "loopBudget must not be null");
        this.listener = listener;
    }

    public ExpressionEvaluator evaluator() {
        return evaluator;
    }

    public LoopBudget loopBudget() {
        return loopBudget;
    }

    /**
     * Parses a template named {@value Template#DEFAULT_NAME}.
     *
     * @throws io.pagecraft.core.error.TemplateSyntaxException if the template is malformed
     */
    public Template parse(String source) {
        return parse(Template.DEFAULT_NAME, source);
    }

    /**
     * Parses a template.
     *
     * @throws io.pagecraft.core.error.TemplateSyntaxException if the template is malformed
     */
    public Template parse(String name, String source) {
        return TemplateParser.parse(name, source);
    }

    /**
     * Parses and renders {@code source} with the given seed bindings.
     *
     * @throws TemplateException on syntax or runtime errors; nothing is returned in that case
     */
    public String render(String source, Map<String, ?> seed) {
        return render(parse(source), seed);
    }

    /** Renders a parsed template with a fresh environment holding the seed bindings. */
    public String render(Template template, Map<String, ?> seed) {
        return render(template, Environment.seeded(seed));
    }

    /**
     * Renders a parsed template against a caller-supplied environment. The environment keeps the
     * bindings made by the template (captures, assignments, functions) after the render.
     */
    public String render(Template template, Environment env) {
        MDC.put(MDC_TEMPLATE, template.name());
        notifyRenderStarted(template);
        long startNanos = System.nanoTime();
        try {
            String output = new TemplateExecutor(evaluator, loopBudget, listener).execute(template, env);
            long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
            LOG.debug(
                    "Rendered template '{}' with evaluator '{}': {} chars in {} ms",
                    template.name(),
                    evaluator.id(),
                    output.length(),
                    elapsedMs);
            notifyRenderCompleted(template, elapsedMs, output.length());
            return output;
        } catch (RuntimeException e) {
            long failedMs = (System.nanoTime() - startNanos) / 1_000_000;
            String detail = e instanceof TemplateException te ? te.detail() : e.toString();
            LOG.debug("Render of template '{}' failed after {} ms: {}", template.name(), failedMs, detail);
            notifyRenderFailed(template, failedMs, detail);
            throw e;
        } finally {
            MDC.remove(MDC_TEMPLATE);
        }
    }

    private void notifyRenderStarted(Template template) {
        if (listener == null) return;
        try {
            listener.onRenderStarted(new RenderListener.RenderStartedEvent(template.name()));
        } catch (Exception e) {
            LOG.warn("RenderListener.onRenderStarted failed", e);
        }
    }

    private void notifyRenderCompleted(Template template, long durationMs, int outputLength) {
        if (listener == null) return;
        try {
            listener.onRenderCompleted(
                    new RenderListener.RenderCompletedEvent(template.name(), durationMs, outputLength));
        } catch (Exception e) {
            LOG.warn("RenderListener.onRenderCompleted failed", e);
        }
    }

    private void notifyRenderFailed(Template template, long durationMs, String errorDetail) {
        if (listener == null) return;
        try {
            listener.onRenderFailed(new RenderListener.RenderFailedEvent(template.name(), durationMs, errorDetail));
        } catch (Exception e) {
            LOG.warn("RenderListener.onRenderFailed failed", e);
        }
    }
}
