package com.ttp.trust.api;

import java.util.List;

/**
 * One contributing path of a result.
 *
 * @param principals      principal ids from source to the last principal on
 *                        the path (the endorser for subject targets)
 * @param hops            decay hop count, including a terminal endorsement
 * @param rawConfidence   decayed product of the path's weights
 * @param appliedDiscount fraction of the raw confidence removed by the
 *                        redundancy discount, in [0, 1]
 */
public record PathExplanation(List<String> principals, int hops, double rawConfidence, double appliedDiscount) {
    public PathExplanation {
        principals = List.copyOf(principals);
    }

    /** Confidence this path actually contributed to aggregation. */
    public double effectiveConfidence() {
        return rawConfidence * (1.0 - appliedDiscount);
    }
}
