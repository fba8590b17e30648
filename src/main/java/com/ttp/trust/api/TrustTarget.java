package com.ttp.trust.api;

import java.util.Objects;

/**
 * Query target: either another principal or a subject.
 */
public record TrustTarget(String id, Kind kind) {

    public enum Kind {
        PRINCIPAL, SUBJECT
    }

    public TrustTarget {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
    }

    public static TrustTarget principal(String id) {
        return new TrustTarget(id, Kind.PRINCIPAL);
    }

    public static TrustTarget subject(String id) {
        return new TrustTarget(id, Kind.SUBJECT);
    }

    public boolean isSubject() {
        return kind == Kind.SUBJECT;
    }
}
