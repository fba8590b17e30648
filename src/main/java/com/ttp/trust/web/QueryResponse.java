package com.ttp.trust.web;

import com.ttp.trust.api.PathExplanation;
import com.ttp.trust.api.TrustResult;
import com.ttp.trust.crypto.CanonicalEncoder;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

/** JSON form of a {@link TrustResult}. */
@Data
public final class QueryResponse {
    private double score;
    private double confidence;
    private List<PathView> explanation;
    private String computedAt;
    private String truncation;
    private boolean belowConfidenceThreshold;

    @Data
    public static final class PathView {
        private List<String> path;
        private int hops;
        private double rawConfidence;
        private double appliedDiscount;
    }

    public static QueryResponse from(TrustResult result) {
        QueryResponse r = new QueryResponse();
        r.setScore(result.score());
        r.setConfidence(result.confidence());
        r.setComputedAt(CanonicalEncoder.formatInstant(result.computedAt()));
        r.setTruncation(result.truncation().name());
        r.setBelowConfidenceThreshold(result.belowConfidenceThreshold());
        List<PathView> paths = new ArrayList<>(result.explanation().size());
        for (PathExplanation p : result.explanation()) {
            PathView v = new PathView();
            v.setPath(p.principals());
            v.setHops(p.hops());
            v.setRawConfidence(p.rawConfidence());
            v.setAppliedDiscount(p.appliedDiscount());
            paths.add(v);
        }
        r.setExplanation(paths);
        return r;
    }
}
