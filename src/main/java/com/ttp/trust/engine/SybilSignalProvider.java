package com.ttp.trust.engine;

import com.ttp.trust.api.SybilFlag;
import com.ttp.trust.api.SybilSignal;
import com.ttp.trust.engine.EdgeGate.WeightedEdge;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives {@link SybilSignal}s for one query, lazily and at most once per
 * principal. Only gate-admitted records are counted, so forged edges cannot
 * make a principal look better or worse connected.
 *
 * <pre>
 * risk = 0.25 * min(1, cluster / highClusterCoefficient)
 *      + 0.20 * min(1, reciprocity / highReciprocity)
 *      + 0.20 * min(1, recentEdges / (2 * rapidEdgeCount))
 *      + 0.15 * (upstream == 0 ? 1 : max(0, 1 - upstream / diversitySaturation))
 *      + 0.20 * max(0, 1 - ageDays / (2 * newAccountDays))
 * </pre>
 */
public final class SybilSignalProvider {
    private final EdgeGate gate;
    private final TrustEngineConfig.SybilConfig config;
    private final Map<String, SybilSignal> signals = new ConcurrentHashMap<>();

    public SybilSignalProvider(EdgeGate gate, TrustEngineConfig.SybilConfig config) {
        this.gate = gate;
        this.config = config;
    }

    public SybilSignal signal(String principalId) {
        return signals.computeIfAbsent(principalId, this::compute);
    }

    private SybilSignal compute(String principalId) {
        Instant now = gate.now();
        List<WeightedEdge> in = gate.incoming(principalId);
        List<WeightedEdge> out = gate.outgoing(principalId);

        Set<String> upstream = new HashSet<>();
        for (WeightedEdge e : in) {
            if (e.weight() > 0.0)
                upstream.add(e.edge().from());
        }

        int reciprocated = 0;
        int recent = 0;
        Instant windowStart = now.minus(Duration.ofDays(config.getRapidEdgeWindowDays()));
        for (WeightedEdge e : out) {
            if (upstream.contains(e.edge().to()))
                reciprocated++;
            if (e.edge().issuedAt().isAfter(windowStart))
                recent++;
        }
        double reciprocity = out.isEmpty() ? 0.0 : (double) reciprocated / out.size();
        double cluster = clusterCoefficient(principalId, in, out);

        long ageDays = gate.snapshot().principalOf(principalId)
                .map(p -> Math.max(0L, Duration.between(p.createdAt(), now).toDays()))
                .orElse(0L);

        int distinct = upstream.size();
        double ageRisk = Math.max(0.0, 1.0 - ageDays / (config.getNewAccountDays() * 2.0));
        double diversityRisk = distinct > 0
                ? Math.max(0.0, 1.0 - distinct / (double) config.getDiversitySaturation())
                : 1.0;
        double reciprocityRisk = Math.min(1.0, reciprocity / config.getHighReciprocity());
        double velocityRisk = Math.min(1.0, recent / (config.getRapidEdgeCount() * 2.0));
        double clusterRisk = Math.min(1.0, cluster / config.getHighClusterCoefficient());
        double risk = 0.25 * clusterRisk + 0.2 * reciprocityRisk + 0.2 * velocityRisk + 0.15 * diversityRisk
                + 0.2 * ageRisk;

        Set<SybilFlag> flags = EnumSet.noneOf(SybilFlag.class);
        if (ageDays < config.getNewAccountDays())
            flags.add(SybilFlag.NEW_ACCOUNT);
        if (distinct < 2)
            flags.add(SybilFlag.LOW_PATH_DIVERSITY);
        if (distinct == 0)
            flags.add(SybilFlag.NO_INBOUND_TRUST);
        if (reciprocity > config.getHighReciprocity())
            flags.add(SybilFlag.HIGH_RECIPROCITY);
        if (recent > config.getRapidEdgeCount())
            flags.add(SybilFlag.RAPID_EDGE_CREATION);
        if (cluster > config.getHighClusterCoefficient())
            flags.add(SybilFlag.HIGH_CLUSTER_COEFFICIENT);

        return new SybilSignal(principalId, in.size(), distinct, ageDays, reciprocity, recent, cluster, risk,
                flags);
    }

    /**
     * Fraction of the k*(k-1) possible directed edges among a principal's
     * neighbors that are present. Neighbors are the peers of its admitted
     * incoming and outgoing edges. Zero with fewer than two neighbors.
     */
    double clusterCoefficient(String principalId, List<WeightedEdge> in, List<WeightedEdge> out) {
        Set<String> neighbors = new LinkedHashSet<>();
        for (WeightedEdge e : in)
            neighbors.add(e.edge().from());
        for (WeightedEdge e : out)
            neighbors.add(e.edge().to());
        neighbors.remove(principalId);
        int k = neighbors.size();
        if (k < 2)
            return 0.0;

        int links = 0;
        for (String n : neighbors) {
            for (WeightedEdge e : gate.outgoing(n)) {
                String to = e.edge().to();
                if (!to.equals(n) && neighbors.contains(to))
                    links++;
            }
        }
        return links / ((double) k * (k - 1));
    }
}
