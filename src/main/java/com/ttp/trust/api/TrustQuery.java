package com.ttp.trust.api;

/**
 * A request for the transitive trust from {@code source} to {@code target}
 * within {@code domain}.
 *
 * @param maxDepth      principal-to-principal hop bound, or null for the
 *                      configured default
 * @param minConfidence post-filter threshold, or null for none
 */
public record TrustQuery(String source, TrustTarget target, String domain, Integer maxDepth,
        Double minConfidence) {

    public TrustQuery {
        if (source == null || source.isBlank())
            throw new IllegalArgumentException("Query source is required");
        if (target == null || target.id().isBlank())
            throw new IllegalArgumentException("Query target is required");
        if (domain == null || domain.isBlank())
            throw new IllegalArgumentException("Query domain is required");
        if (maxDepth != null && maxDepth < 0)
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        if (minConfidence != null && (minConfidence < 0.0 || minConfidence > 1.0 || minConfidence.isNaN()))
            throw new IllegalArgumentException("minConfidence must be in [0,1], got " + minConfidence);
    }

    public static TrustQuery of(String source, TrustTarget target, String domain) {
        return new TrustQuery(source, target, domain, null, null);
    }

    public TrustQuery withMaxDepth(int depth) {
        return new TrustQuery(source, target, domain, depth, minConfidence);
    }

    public TrustQuery withMinConfidence(double threshold) {
        return new TrustQuery(source, target, domain, maxDepth, threshold);
    }
}
