package com.ttp.trust.engine;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Redundancy discounts and structural confidence.
 *
 * <p>
 * A contributor that already appeared on a higher-ranked path discounts the
 * path at rank i by {@code 1 - redundancyPenalty * dominance}, where dominance
 * is the fraction of paths 0..i it sits on. Paths ranked below i never
 * change {@code r_i}, so a path added at the bottom of the ranking can only
 * raise the score.
 *
 * <p>
 * Confidence reflects how much independent, low-risk support the score rests
 * on; it never changes the score.
 */
public final class SybilScorer {
    /** Pairwise overlap is measured over at most this many top-ranked paths. */
    static final int DIVERSITY_SAMPLE = 64;

    private final TrustEngineConfig.SybilConfig config;

    public SybilScorer(TrustEngineConfig.SybilConfig config) {
        this.config = config;
    }

    /** Redundancy factor {@code r_i} per ranked path, in (0,1]. */
    public double[] redundancyFactors(List<ScoredPath> ranked) {
        int n = ranked.size();
        double[] factors = new double[n];
        if (n == 0)
            return factors;

        Map<String, Integer> occurrences = new HashMap<>();
        for (int i = 0; i < n; i++) {
            double r = 1.0;
            int prefix = i + 1;
            for (String p : ranked.get(i).path().contributors()) {
                int count = occurrences.merge(p, 1, Integer::sum);
                if (count > 1)
                    r *= 1.0 - config.getRedundancyPenalty() * count / prefix;
            }
            factors[i] = r;
        }
        return factors;
    }

    /**
     * Structural confidence of a non-empty ranked path set, reduced by the
     * mean sybil risk of its contributors.
     */
    public double confidence(List<ScoredPath> ranked, SybilSignalProvider signals) {
        int n = ranked.size();
        if (n == 0)
            return 1.0;

        Set<String> allContributors = new LinkedHashSet<>();
        for (ScoredPath s : ranked)
            allContributors.addAll(s.path().contributors());

        double structure;
        if (allContributors.isEmpty()) {
            structure = 1.0;
        } else {
            double support = 1.0 - Math.exp(-n / 3.0);
            structure = (support + diversity(ranked)) / 2.0;
        }

        double risk = 0.0;
        if (!allContributors.isEmpty()) {
            for (String p : allContributors)
                risk += signals.signal(p).riskScore();
            risk /= allContributors.size();
        }
        return clamp(structure * (1.0 - config.getRiskWeight() * risk));
    }

    /** One minus the mean pairwise Jaccard overlap of contributor sets. */
    static double diversity(List<ScoredPath> ranked) {
        int n = Math.min(ranked.size(), DIVERSITY_SAMPLE);
        if (n < 2)
            return 0.0;
        double overlap = 0.0;
        int pairs = 0;
        for (int i = 0; i < n; i++) {
            Set<String> a = ranked.get(i).path().contributors();
            for (int j = i + 1; j < n; j++) {
                overlap += jaccard(a, ranked.get(j).path().contributors());
                pairs++;
            }
        }
        return 1.0 - overlap / pairs;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty())
            return 0.0;
        int common = 0;
        for (String s : a) {
            if (b.contains(s))
                common++;
        }
        int union = a.size() + b.size() - common;
        return (double) common / union;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
