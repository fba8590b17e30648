package com.ttp.trust.api;

/**
 * Read interface the engine consumes, implemented by the storage layer.
 *
 * <p>
 * The engine never mutates the store. Each query opens one
 * {@link GraphSnapshot}, which must provide repeatable reads until it is
 * closed (a read transaction or an immutable copy). Without that, a query
 * could mix records from before and after a write.
 *
 * <p>
 * Writes happen elsewhere. The store reports them through
 * {@link GraphChangeListener}s so that cached results can be invalidated.
 */
public interface GraphAccessPort {

    /**
     * Opens a consistent read view for a single query.
     *
     * @throws PortUnavailableException if the store cannot be reached
     */
    GraphSnapshot openSnapshot();

    /** Registers a listener for graph mutations. */
    void addChangeListener(GraphChangeListener listener);

    void removeChangeListener(GraphChangeListener listener);
}
