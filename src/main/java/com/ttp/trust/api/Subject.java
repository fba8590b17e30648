package com.ttp.trust.api;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Endorsement target. Subjects never sign anything.
 */
public record Subject(String id, SubjectType type, Set<String> domains, GeoLocation location,
        Map<String, String> externalIds) {
    public Subject {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        domains = domains == null ? Set.of() : Set.copyOf(domains);
        externalIds = externalIds == null ? Map.of() : Map.copyOf(externalIds);
    }
}
