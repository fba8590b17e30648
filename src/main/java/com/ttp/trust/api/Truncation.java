package com.ttp.trust.api;

/**
 * Why a result may be partial. Anything other than {@link #NONE} reduces the
 * reported confidence.
 */
public enum Truncation {
    NONE,
    /** Requested depth exceeded the configured hard limit and was clamped. */
    DEPTH_LIMIT,
    /** The per-query node visit budget ran out. */
    NODE_BUDGET,
    /** The wall-clock deadline passed or the calling thread was interrupted. */
    DEADLINE,
    /** At least one principal had more outgoing edges than the fan-out limit. */
    FAN_OUT;

    public boolean isPartial() {
        return this != NONE;
    }
}
