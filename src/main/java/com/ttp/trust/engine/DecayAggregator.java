package com.ttp.trust.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Path confidence and score aggregation.
 *
 * <pre>
 * raw(path) = product(effective weights) * decay(hops) [* recency(endorsement)]
 * score     = 1 - product(1 - raw_i * r_i)     DIMINISHING_RETURNS
 *           = max(raw_i * r_i)                MAXIMUM
 * </pre>
 *
 * where {@code r_i} is the redundancy factor of the path at rank i.
 */
public final class DecayAggregator {
    private static final double SECONDS_PER_DAY = 86_400.0;

    static final Comparator<ScoredPath> RANKING = Comparator
            .comparingDouble(ScoredPath::rawConfidence).reversed()
            .thenComparing(s -> s.path().pathKey());

    private final TrustEngineConfig config;

    public DecayAggregator(TrustEngineConfig config) {
        this.config = config;
    }

    public double rawConfidence(CandidatePath path, Instant now) {
        double raw = path.weightProduct() * config.getDecayFunction().apply(path.hops(), config);
        if (path.endorsement() != null)
            raw *= recency(path.endorsement().issuedAt(), now);
        return raw;
    }

    /**
     * Half-life decay of an endorsement's weight with age. Returns 1 when no
     * half-life is configured.
     */
    public double recency(Instant issuedAt, Instant now) {
        double halfLife = config.getEndorsementHalfLifeDays();
        if (halfLife <= 0)
            return 1.0;
        double ageDays = Math.max(0.0, Duration.between(issuedAt, now).getSeconds() / SECONDS_PER_DAY);
        return Math.pow(0.5, ageDays / halfLife);
    }

    /** Scores and orders paths: raw confidence descending, ties by path ids. */
    public List<ScoredPath> rank(List<CandidatePath> paths, Instant now) {
        List<ScoredPath> out = new ArrayList<>(paths.size());
        for (CandidatePath p : paths)
            out.add(new ScoredPath(p, rawConfidence(p, now)));
        out.sort(RANKING);
        return out;
    }

    /**
     * Combines ranked path confidences.
     *
     * @param ranked     paths in rank order
     * @param redundancy redundancy factor per path, same order
     */
    public double aggregate(List<ScoredPath> ranked, double[] redundancy) {
        if (ranked.isEmpty())
            return 0.0;
        return switch (config.getAggregation()) {
            case MAXIMUM -> {
                double max = 0.0;
                for (int i = 0; i < ranked.size(); i++)
                    max = Math.max(max, ranked.get(i).rawConfidence() * redundancy[i]);
                yield clamp(max);
            }
            case DIMINISHING_RETURNS -> {
                double miss = 1.0;
                for (int i = 0; i < ranked.size(); i++)
                    miss *= 1.0 - ranked.get(i).rawConfidence() * redundancy[i];
                yield clamp(1.0 - miss);
            }
        };
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
