package com.ttp.trust.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity anchor for signature verification.
 *
 * @param id        stable principal id
 * @param type      principal kind
 * @param publicKey registered public key, base64 encoded
 * @param createdAt registration time, used for account-age signals
 */
public record Principal(String id, PrincipalType type, String publicKey, Instant createdAt) {
    public Principal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
