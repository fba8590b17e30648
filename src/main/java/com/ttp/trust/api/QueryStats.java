package com.ttp.trust.api;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Work counters for a single query.
 */
public record QueryStats(int nodesVisited, int edgesExamined, int pathsFound, Map<ExclusionReason, Integer> exclusions) {

    public static final QueryStats EMPTY = new QueryStats(0, 0, 0, Map.of());

    public QueryStats {
        EnumMap<ExclusionReason, Integer> copy = new EnumMap<>(ExclusionReason.class);
        if (exclusions != null)
            copy.putAll(exclusions);
        exclusions = Collections.unmodifiableMap(copy);
    }

    public int exclusionCount(ExclusionReason reason) {
        return exclusions.getOrDefault(reason, 0);
    }

    public int totalExclusions() {
        int total = 0;
        for (int n : exclusions.values())
            total += n;
        return total;
    }
}
