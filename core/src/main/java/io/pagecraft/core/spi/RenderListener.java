package io.pagecraft.core.spi;

import io.pagecraft.core.model.Location;

/**
 * Observability hooks for renders.
 *
 * <p>All methods receive immutable event objects. Implementations MUST be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught by the engine and logged; they do NOT
 * affect the render.
 */
public interface RenderListener {

    /** Called when a render begins. */
    void onRenderStarted(RenderStartedEvent event);

    /** Called when a render completes successfully. */
    void onRenderCompleted(RenderCompletedEvent event);

    /** Called when a render fails with a runtime error. */
    void onRenderFailed(RenderFailedEvent event);

    /**
     * Called when a {@code while} loop is stopped because it exceeded its time limit. The render
     * continues after the loop.
     */
    void onLoopTerminated(LoopTerminatedEvent event);

    // --- Event records ---

    /** Event emitted when a render starts. */
    record RenderStartedEvent(String templateName) {}

    /** Event emitted when a render completes successfully. */
    record RenderCompletedEvent(String templateName, long durationMs, int outputLength) {}

    /** Event emitted when a render fails. */
    record RenderFailedEvent(String templateName, long durationMs, String errorDetail) {}

    /** Event emitted when a {@code while} loop is cut short by its time limit. */
    record LoopTerminatedEvent(String templateName, String expression, Location location, int iterations) {}
}
