package com.ttp.trust.api;

import java.util.Set;

/**
 * Per-principal summary of graph position, derived lazily from verified
 * records and never persisted.
 *
 * @param inDegree           verified incoming trust edges
 * @param distinctUpstream   distinct principals behind those edges
 * @param accountAgeDays     days since registration, 0 if unknown
 * @param reciprocity        fraction of outgoing edges that are returned
 * @param recentEdgeCount    outgoing edges issued inside the velocity window
 * @param clusterCoefficient density of trust among the principal's neighbors
 * @param riskScore          combined risk in [0, 1]
 */
public record SybilSignal(String principalId, int inDegree, int distinctUpstream, long accountAgeDays,
        double reciprocity, int recentEdgeCount, double clusterCoefficient, double riskScore, Set<SybilFlag> flags) {

    public SybilSignal {
        flags = Set.copyOf(flags);
    }

    public boolean has(SybilFlag flag) {
        return flags.contains(flag);
    }
}
