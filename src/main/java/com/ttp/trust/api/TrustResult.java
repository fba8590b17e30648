package com.ttp.trust.api;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a trust query.
 *
 * <p>
 * {@code score} is the aggregated trust in [0, 1]. {@code confidence} is a
 * separate measure of how structurally sound the derivation is. It never
 * alters the score. A result with no paths has score 0 and confidence 1,
 * because absence is a definite answer. A truncated result carries reduced
 * confidence and a {@link Truncation} flag instead.
 */
public record TrustResult(double score, double confidence, List<PathExplanation> explanation, Instant computedAt,
        Truncation truncation, boolean belowConfidenceThreshold, QueryStats stats) {

    public TrustResult {
        explanation = List.copyOf(explanation);
        if (truncation == null)
            truncation = Truncation.NONE;
        if (stats == null)
            stats = QueryStats.EMPTY;
    }

    public static TrustResult noPath(Instant computedAt, QueryStats stats) {
        return new TrustResult(0.0, 1.0, List.of(), computedAt, Truncation.NONE, false, stats);
    }

    public boolean isTruncated() {
        return truncation.isPartial();
    }

    /**
     * Applies the caller's minimum-confidence threshold. The score drops to
     * zero but the confidence and the paths stay visible.
     */
    public TrustResult filterByConfidence(Double minConfidence) {
        if (minConfidence == null || confidence >= minConfidence)
            return this;
        return new TrustResult(0.0, confidence, explanation, computedAt, truncation, true, stats);
    }
}
