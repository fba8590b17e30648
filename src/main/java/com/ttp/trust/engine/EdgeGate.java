package com.ttp.trust.engine;

import com.ttp.trust.api.DistrustEdge;
import com.ttp.trust.api.Domain;
import com.ttp.trust.api.Endorsement;
import com.ttp.trust.api.ExclusionReason;
import com.ttp.trust.api.GraphSnapshot;
import com.ttp.trust.api.SignedRecord;
import com.ttp.trust.api.TrustComputationListener;
import com.ttp.trust.api.TrustEdge;
import com.ttp.trust.crypto.SignatureVerifier;
import com.ttp.trust.domain.DomainForest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.function.Function;

/**
 * Admits records into one query's view of the graph.
 *
 * <p>
 * A record passes when its domain is the query domain or one of its
 * ancestors, its weight is in [0,1], it is live at the query instant, its
 * signer has a registered key and the signature verifies against that key.
 * Each record is judged once per query; exclusions are counted and reported
 * on first sight only.
 *
 * <p>
 * Among admitted records for the same endpoints, the most specific domain
 * wins, then the latest {@code issuedAt}. A record declared in an ancestor
 * domain is discounted by {@code inheritanceDiscount^distance}; a record
 * declared for {@code *} applies everywhere at full weight. Outgoing lists
 * are ordered by effective weight descending, ties by target id.
 *
 * <p>
 * Thread-safe. Enumeration branches share one gate.
 */
public final class EdgeGate {
    /** A trust edge with the inheritance discount applied. */
    public record WeightedEdge(TrustEdge edge, double weight) {
    }

    /** An endorsement with the inheritance discount applied. */
    public record WeightedEndorsement(Endorsement endorsement, double weight) {
    }

    private static final Comparator<WeightedEdge> BY_WEIGHT = Comparator
            .comparingDouble(WeightedEdge::weight).reversed()
            .thenComparing(w -> w.edge().to());

    private final GraphSnapshot snapshot;
    private final SignatureVerifier verifier;
    private final DomainForest forest;
    private final String domain;
    private final double inheritanceDiscount;
    private final Instant now;
    private final TrustComputationListener listener;

    private final Map<SignedRecord, Optional<ExclusionReason>> verdicts = new ConcurrentHashMap<>();
    private final Map<String, List<WeightedEdge>> outgoing = new ConcurrentHashMap<>();
    private final Map<String, List<WeightedEdge>> incoming = new ConcurrentHashMap<>();
    private final Map<String, Map<String, WeightedEndorsement>> endorsements = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> distrusted = new ConcurrentHashMap<>();
    private final AtomicInteger edgesExamined = new AtomicInteger();
    private final AtomicIntegerArray exclusions = new AtomicIntegerArray(ExclusionReason.values().length);

    public EdgeGate(GraphSnapshot snapshot, SignatureVerifier verifier, String domain, double inheritanceDiscount,
            Instant now, TrustComputationListener listener) {
        this.snapshot = snapshot;
        this.verifier = verifier;
        this.forest = snapshot.domains();
        this.domain = domain;
        this.inheritanceDiscount = inheritanceDiscount;
        this.now = now;
        this.listener = listener;
    }

    public Instant now() {
        return now;
    }

    public GraphSnapshot snapshot() {
        return snapshot;
    }

    /** Admitted outgoing edges of a principal, strongest first. */
    public List<WeightedEdge> outgoing(String principalId) {
        return outgoing.computeIfAbsent(principalId, p -> {
            List<WeightedEdge> admitted = admitEdges(snapshot.outgoingTrustEdges(p, domain), TrustEdge::to);
            admitted.sort(BY_WEIGHT);
            return Collections.unmodifiableList(admitted);
        });
    }

    /** Admitted incoming edges of a principal, one per upstream principal. */
    public List<WeightedEdge> incoming(String principalId) {
        return incoming.computeIfAbsent(principalId, p -> {
            List<WeightedEdge> admitted = admitEdges(snapshot.incomingTrustEdges(p, domain), TrustEdge::from);
            admitted.sort(Comparator.comparing(w -> w.edge().from()));
            return Collections.unmodifiableList(admitted);
        });
    }

    /** Admitted endorsement of {@code subjectId} issued by {@code principalId}, if any. */
    public Optional<WeightedEndorsement> endorsement(String principalId, String subjectId) {
        return Optional.ofNullable(endorsementsOf(subjectId).get(principalId));
    }

    /** Admitted endorsements of a subject keyed by endorser. */
    public Map<String, WeightedEndorsement> endorsementsOf(String subjectId) {
        return endorsements.computeIfAbsent(subjectId, s -> {
            Map<String, WeightedEndorsement> best = new LinkedHashMap<>();
            Map<String, Integer> bestDistance = new HashMap<>();
            for (Endorsement e : snapshot.incomingEndorsements(s, domain)) {
                int distance = admit(e);
                if (distance < 0)
                    continue;
                WeightedEndorsement current = best.get(e.from());
                if (current == null || supersedes(e, distance, current.endorsement(), bestDistance.get(e.from()))) {
                    best.put(e.from(), new WeightedEndorsement(e, discounted(e, distance)));
                    bestDistance.put(e.from(), distance);
                }
            }
            return Collections.unmodifiableMap(best);
        });
    }

    /** True when {@code viewerId} holds an admitted distrust record against {@code principalId}. */
    public boolean distrusts(String viewerId, String principalId) {
        return distrustedBy(viewerId).contains(principalId);
    }

    private Set<String> distrustedBy(String viewerId) {
        return distrusted.computeIfAbsent(viewerId, v -> {
            Set<String> out = new HashSet<>();
            for (DistrustEdge d : snapshot.outgoingDistrustEdges(v, domain)) {
                if (admit(d) >= 0)
                    out.add(d.to());
            }
            return Collections.unmodifiableSet(out);
        });
    }

    public int edgesExamined() {
        return edgesExamined.get();
    }

    public Map<ExclusionReason, Integer> exclusions() {
        Map<ExclusionReason, Integer> out = new EnumMap<>(ExclusionReason.class);
        for (ExclusionReason r : ExclusionReason.values()) {
            int n = exclusions.get(r.ordinal());
            if (n > 0)
                out.put(r, n);
        }
        return out;
    }

    private List<WeightedEdge> admitEdges(List<TrustEdge> candidates, Function<TrustEdge, String> peer) {
        Map<String, TrustEdge> best = new LinkedHashMap<>();
        Map<String, Integer> bestDistance = new HashMap<>();
        for (TrustEdge e : candidates) {
            int distance = admit(e);
            if (distance < 0)
                continue;
            String key = peer.apply(e);
            TrustEdge current = best.get(key);
            if (current == null || supersedes(e, distance, current, bestDistance.get(key))) {
                best.put(key, e);
                bestDistance.put(key, distance);
            }
        }
        List<WeightedEdge> out = new ArrayList<>(best.size());
        for (Map.Entry<String, TrustEdge> entry : best.entrySet()) {
            TrustEdge e = entry.getValue();
            out.add(new WeightedEdge(e, discounted(e, bestDistance.get(entry.getKey()))));
        }
        return out;
    }

    private static boolean supersedes(SignedRecord candidate, int distance, SignedRecord current,
            int currentDistance) {
        if (distance != currentDistance)
            return distance < currentDistance;
        return candidate.issuedAt().isAfter(current.issuedAt());
    }

    private double discounted(SignedRecord record, int distance) {
        if (distance == 0 || Domain.WILDCARD.equals(record.domain()))
            return record.weight();
        return record.weight() * Math.pow(inheritanceDiscount, distance);
    }

    /**
     * Judges a record once per query.
     *
     * @return domain distance of an admitted record, -1 if excluded
     */
    private int admit(SignedRecord record) {
        edgesExamined.incrementAndGet();
        Optional<ExclusionReason> verdict = verdicts.computeIfAbsent(record, this::judge);
        if (verdict.isPresent())
            return -1;
        return forest.distance(record.domain(), domain);
    }

    private Optional<ExclusionReason> judge(SignedRecord record) {
        ExclusionReason reason = check(record);
        if (reason != null) {
            exclusions.incrementAndGet(reason.ordinal());
            listener.onRecordExcluded(reason, record);
        }
        return Optional.ofNullable(reason);
    }

    private ExclusionReason check(SignedRecord record) {
        if (forest.distance(record.domain(), domain) < 0)
            return ExclusionReason.DOMAIN_MISMATCH;
        double w = record.weight();
        if (Double.isNaN(w) || w < 0.0 || w > 1.0)
            return ExclusionReason.WEIGHT_OUT_OF_RANGE;
        if (!record.isLiveAt(now))
            return record.issuedAt().isAfter(now) ? ExclusionReason.NOT_YET_VALID : ExclusionReason.EXPIRED;
        Optional<String> key = snapshot.publicKeyOf(record.from());
        if (key.isEmpty())
            return ExclusionReason.UNKNOWN_SIGNER;
        if (!verifier.verify(record, key.get()))
            return ExclusionReason.INVALID_SIGNATURE;
        return null;
    }
}
