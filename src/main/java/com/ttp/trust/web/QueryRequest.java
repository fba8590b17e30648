package com.ttp.trust.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustTarget;

import java.util.Locale;

import lombok.Data;

/** Body of {@code POST /api/trust/query}. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class QueryRequest {
    /** Optional; resolved from the caller when absent. */
    private String source;
    private String target;
    /** {@code principal} (default) or {@code subject}. */
    private String targetKind = "principal";
    private String domain;
    private Integer maxDepth;
    private Double minConfidence;

    /**
     * @throws IllegalArgumentException for a missing field or unknown target kind
     */
    public TrustQuery toQuery(String resolvedSource) {
        if (target == null || target.isBlank())
            throw new IllegalArgumentException("target is required");
        TrustTarget t = switch (targetKind == null ? "principal" : targetKind.toLowerCase(Locale.ROOT)) {
            case "principal" -> TrustTarget.principal(target);
            case "subject" -> TrustTarget.subject(target);
            default -> throw new IllegalArgumentException("Unknown targetKind: " + targetKind);
        };
        return new TrustQuery(resolvedSource, t, domain, maxDepth, minConfidence);
    }
}
