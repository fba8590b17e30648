package com.ttp.trust.engine;

/**
 * How discounted path confidences are combined into one score.
 */
public enum AggregationStrategy {
    /**
     * {@code 1 - prod(1 - p_i * r_i)}. Every extra path raises the score, each
     * by less than the one before.
     */
    DIMINISHING_RETURNS,
    /** Best single discounted path. */
    MAXIMUM
}
