package com.ttp.trust.api;

import java.util.Locale;

/**
 * Closed set of signature algorithms accepted on trust-relevant records.
 */
public enum SignatureAlgorithm {
    ED25519("ed25519"),
    SECP256K1("secp256k1");

    private final String wireName;

    SignatureAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    /** Lower-case name used in signed-record payloads and fixtures. */
    public String wireName() {
        return wireName;
    }

    public static SignatureAlgorithm fromString(String name) {
        if (name == null)
            throw new IllegalArgumentException("Signature algorithm is required");
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "ed25519" -> ED25519;
            case "secp256k1" -> SECP256K1;
            default -> throw new IllegalArgumentException("Unsupported signature algorithm: " + name);
        };
    }
}
