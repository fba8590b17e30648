package com.ttp.trust.api;

import java.time.Instant;

/**
 * Common view of the two trust-relevant record types.
 *
 * <p>
 * A signed record is a statement made by {@link #from()} about
 * {@link #targetId()} inside {@link #domain()}. It is trust-eligible only if
 * its signature verifies against the signer's registered key and
 * {@code issuedAt <= now < expiresAt}.
 *
 * <p>
 * Instants are held at millisecond precision, the precision the signed
 * payload carries, so two records with the same signed bytes are equal.
 */
public interface SignedRecord {

    /** Signing principal. */
    String from();

    /** Trusted principal or endorsed subject. */
    String targetId();

    String domain();

    double weight();

    Instant issuedAt();

    /** Expiry, or null when the record does not expire. */
    Instant expiresAt();

    /** Signature, or null for a record that has not been signed yet. */
    Signature signature();

    /** True when the record's validity window contains {@code now}. */
    default boolean isLiveAt(Instant now) {
        return !issuedAt().isAfter(now) && (expiresAt() == null || now.isBefore(expiresAt()));
    }
}
