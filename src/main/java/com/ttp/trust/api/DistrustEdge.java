package com.ttp.trust.api;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * {@code from} explicitly distrusts {@code to} within {@code domain}. Not a
 * trust edge of weight zero: a distrusted principal is never entered by
 * queries whose source is {@code from}, whoever vouches for it.
 */
public record DistrustEdge(String from, String to, String domain, DistrustReason reason, Instant issuedAt,
        Instant expiresAt, Signature signature) implements SignedRecord {

    public DistrustEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(issuedAt, "issuedAt");
        if (reason == null)
            reason = DistrustReason.OTHER;
        issuedAt = issuedAt.truncatedTo(ChronoUnit.MILLIS);
        if (expiresAt != null)
            expiresAt = expiresAt.truncatedTo(ChronoUnit.MILLIS);
    }

    public static DistrustEdge unsigned(String from, String to, String domain, DistrustReason reason,
            Instant issuedAt) {
        return new DistrustEdge(from, to, domain, reason, issuedAt, null, null);
    }

    @Override
    public String targetId() {
        return to;
    }

    /** Always 1. Distrust is not graded. */
    @Override
    public double weight() {
        return 1.0;
    }

    public DistrustEdge withSignature(Signature newSignature) {
        return new DistrustEdge(from, to, domain, reason, issuedAt, expiresAt, newSignature);
    }

    public DistrustEdge withExpiresAt(Instant newExpiresAt) {
        return new DistrustEdge(from, to, domain, reason, issuedAt, newExpiresAt, signature);
    }

    @Override
    public String toString() {
        return "DistrustEdge[" + from + " -x " + to + " @" + domain + " " + reason.wireName() + "]";
    }
}
