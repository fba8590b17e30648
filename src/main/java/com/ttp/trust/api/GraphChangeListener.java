package com.ttp.trust.api;

/**
 * Receives mutation signals from a {@link GraphAccessPort}.
 *
 * <p>
 * Called on the writer's thread. Implementations must return quickly. The
 * engine's implementation only enqueues the change.
 */
@FunctionalInterface
public interface GraphChangeListener {
    void onGraphChange(GraphChange change);
}
