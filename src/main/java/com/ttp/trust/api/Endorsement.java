package com.ttp.trust.api;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A principal's signed evaluation of a subject. {@code weight} is the
 * normalized rating in [0, 1]. This is the terminal edge of a path into a
 * subject.
 */
public record Endorsement(String from, String subject, String domain, double weight, Instant issuedAt,
        Instant expiresAt, Signature signature) implements SignedRecord {

    public Endorsement {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(issuedAt, "issuedAt");
        issuedAt = issuedAt.truncatedTo(ChronoUnit.MILLIS);
        if (expiresAt != null)
            expiresAt = expiresAt.truncatedTo(ChronoUnit.MILLIS);
    }

    public static Endorsement unsigned(String from, String subject, String domain, double weight,
            Instant issuedAt) {
        return new Endorsement(from, subject, domain, weight, issuedAt, null, null);
    }

    @Override
    public String targetId() {
        return subject;
    }

    public Endorsement withSignature(Signature newSignature) {
        return new Endorsement(from, subject, domain, weight, issuedAt, expiresAt, newSignature);
    }

    public Endorsement withExpiresAt(Instant newExpiresAt) {
        return new Endorsement(from, subject, domain, weight, issuedAt, newExpiresAt, signature);
    }

    @Override
    public String toString() {
        return "Endorsement[" + from + " -> " + subject + " @" + domain + " w=" + weight + "]";
    }
}
