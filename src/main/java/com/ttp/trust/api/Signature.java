package com.ttp.trust.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Binds the signer's declared public key to the canonical encoding of a
 * record's payload. Key and signature bytes are base64 encoded.
 */
public record Signature(SignatureAlgorithm algorithm, String publicKey, String signature, Instant signedAt) {
    public Signature {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(signature, "signature");
    }

    /** Returns a copy carrying different signature bytes. */
    public Signature withSignature(String newSignature) {
        return new Signature(algorithm, publicKey, newSignature, signedAt);
    }
}
