package com.ttp.trust.api;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * {@code from} delegates trust to {@code to} within {@code domain}.
 * Directed and not necessarily symmetric.
 */
public record TrustEdge(String from, String to, String domain, double weight, Instant issuedAt,
        Instant expiresAt, Signature signature) implements SignedRecord {

    public TrustEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(issuedAt, "issuedAt");
        issuedAt = issuedAt.truncatedTo(ChronoUnit.MILLIS);
        if (expiresAt != null)
            expiresAt = expiresAt.truncatedTo(ChronoUnit.MILLIS);
    }

    /** Creates an unsigned edge that never expires. */
    public static TrustEdge unsigned(String from, String to, String domain, double weight, Instant issuedAt) {
        return new TrustEdge(from, to, domain, weight, issuedAt, null, null);
    }

    @Override
    public String targetId() {
        return to;
    }

    public TrustEdge withSignature(Signature newSignature) {
        return new TrustEdge(from, to, domain, weight, issuedAt, expiresAt, newSignature);
    }

    public TrustEdge withExpiresAt(Instant newExpiresAt) {
        return new TrustEdge(from, to, domain, weight, issuedAt, newExpiresAt, signature);
    }

    public TrustEdge withWeight(double newWeight) {
        return new TrustEdge(from, to, domain, newWeight, issuedAt, expiresAt, signature);
    }

    @Override
    public String toString() {
        return "TrustEdge[" + from + " -> " + to + " @" + domain + " w=" + weight + "]";
    }
}
