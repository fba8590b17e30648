package com.ttp.trust.api;

/**
 * Observability hook for the query engine.
 *
 * <p>
 * Callbacks run on query threads, and {@link #onRecordExcluded} may run on
 * several enumeration workers at once. Implementations must be thread-safe
 * and cheap. Blocking here slows every query.
 */
public interface TrustComputationListener {

    /**
     * Called before a query is answered, cache hits included.
     */
    void onQueryStart(TrustQuery query);

    /**
     * Called when a query is answered from the cache.
     */
    default void onCacheHit(TrustQuery query) {
    }

    /**
     * Called once per record per query when the record is left out of the
     * computation.
     *
     * @param reason why the record was excluded
     * @param record the excluded record
     */
    void onRecordExcluded(ExclusionReason reason, SignedRecord record);

    /**
     * Called after a result was produced.
     *
     * @param durationNanos wall time spent, including cache lookups
     */
    void onQueryEnd(TrustQuery query, TrustResult result, long durationNanos);

    /**
     * Called when a query failed, typically with a
     * {@link PortUnavailableException}.
     */
    void onQueryError(TrustQuery query, Throwable error);
}
