package com.ttp.trust.api;

import java.util.Locale;

/** Why a principal declared distrust. Part of the signed payload. */
public enum DistrustReason {
    SPAM,
    MALICIOUS,
    INCOMPETENT,
    CONFLICT_OF_INTEREST,
    OTHER;

    /** Lower-case name used in signed-record payloads and fixtures. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DistrustReason fromString(String name) {
        if (name == null)
            return OTHER;
        return valueOf(name.toUpperCase(Locale.ROOT));
    }
}
