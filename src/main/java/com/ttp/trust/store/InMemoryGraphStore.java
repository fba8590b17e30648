package com.ttp.trust.store;

import com.ttp.trust.api.DistrustEdge;
import com.ttp.trust.api.Domain;
import com.ttp.trust.api.Endorsement;
import com.ttp.trust.api.GraphAccessPort;
import com.ttp.trust.api.GraphChange;
import com.ttp.trust.api.GraphChangeListener;
import com.ttp.trust.api.GraphSnapshot;
import com.ttp.trust.api.PortUnavailableException;
import com.ttp.trust.api.Principal;
import com.ttp.trust.api.SignedRecord;
import com.ttp.trust.api.Subject;
import com.ttp.trust.api.TrustEdge;
import com.ttp.trust.domain.DomainForest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import lombok.extern.log4j.Log4j2;

/**
 * Reference {@link GraphAccessPort} held entirely in memory.
 *
 * <p>
 * Writes build a new immutable {@link State} and swap it in; a snapshot pins
 * the state current at {@link #openSnapshot()}, which gives every query
 * repeatable reads without locking. Edge lookups return records of the
 * requested domain and of its ancestors.
 *
 * <p>
 * The store does not verify signatures. Records are kept as written and
 * judged by the engine on every query.
 */
@Log4j2
public class InMemoryGraphStore implements GraphAccessPort {

    private record State(
            Map<String, Principal> principals,
            Map<String, Subject> subjects,
            List<Domain> domainList,
            DomainForest forest,
            Map<String, List<TrustEdge>> outgoing,
            Map<String, List<TrustEdge>> incoming,
            Map<String, List<Endorsement>> endorsements,
            Map<String, List<DistrustEdge>> distrust) {

        static final State EMPTY = new State(Map.of(), Map.of(), List.of(), DomainForest.empty(), Map.of(),
                Map.of(), Map.of(), Map.of());
    }

    private volatile State state = State.EMPTY;
    private volatile String unavailableReason;
    private final List<GraphChangeListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public GraphSnapshot openSnapshot() {
        String reason = unavailableReason;
        if (reason != null)
            throw new PortUnavailableException("Graph store unavailable: " + reason);
        return new Snapshot(state);
    }

    @Override
    public void addChangeListener(GraphChangeListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeChangeListener(GraphChangeListener listener) {
        listeners.remove(listener);
    }

    /** Makes every subsequent {@link #openSnapshot()} fail until {@link #markAvailable()}. */
    public void markUnavailable(String reason) {
        unavailableReason = reason;
        log.warn("Graph store marked unavailable: {}", reason);
    }

    public void markAvailable() {
        unavailableReason = null;
    }

    // --- Writes ---

    public void addPrincipal(Principal principal) {
        synchronized (this) {
            Map<String, Principal> next = new HashMap<>(state.principals());
            next.put(principal.id(), principal);
            State s = state;
            state = new State(Map.copyOf(next), s.subjects(), s.domainList(), s.forest(), s.outgoing(),
                    s.incoming(), s.endorsements(), s.distrust());
        }
        fire(GraphChange.principal(principal.id()));
    }

    public void addSubject(Subject subject) {
        synchronized (this) {
            Map<String, Subject> next = new HashMap<>(state.subjects());
            next.put(subject.id(), subject);
            State s = state;
            state = new State(s.principals(), Map.copyOf(next), s.domainList(), s.forest(), s.outgoing(),
                    s.incoming(), s.endorsements(), s.distrust());
        }
    }

    public void addDomain(Domain domain) {
        addDomains(List.of(domain));
    }

    /**
     * Adds domains in one step. The whole batch is rejected if it leaves the
     * hierarchy with a missing parent or a cycle.
     *
     * @throws com.ttp.trust.domain.CyclicDomainHierarchyException on a cycle
     * @throws IllegalArgumentException on a duplicate or unknown parent
     */
    public void addDomains(Collection<Domain> domains) {
        if (domains.isEmpty())
            return;
        synchronized (this) {
            State s = state;
            List<Domain> all = new ArrayList<>(s.domainList());
            all.addAll(domains);
            DomainForest forest = DomainForest.builder().addAll(all).build();
            state = new State(s.principals(), s.subjects(), List.copyOf(all), forest, s.outgoing(), s.incoming(),
                    s.endorsements(), s.distrust());
        }
        for (Domain d : domains)
            fire(GraphChange.domain(d.id()));
    }

    public void addTrustEdge(TrustEdge edge) {
        synchronized (this) {
            State s = state;
            state = new State(s.principals(), s.subjects(), s.domainList(), s.forest(),
                    appended(s.outgoing(), edge.from(), edge), appended(s.incoming(), edge.to(), edge),
                    s.endorsements(), s.distrust());
        }
        fire(GraphChange.trustEdge(edge));
    }

    public void addEndorsement(Endorsement endorsement) {
        synchronized (this) {
            State s = state;
            state = new State(s.principals(), s.subjects(), s.domainList(), s.forest(), s.outgoing(),
                    s.incoming(), appended(s.endorsements(), endorsement.subject(), endorsement), s.distrust());
        }
        fire(GraphChange.endorsement(endorsement));
    }

    public void addDistrustEdge(DistrustEdge distrust) {
        synchronized (this) {
            State s = state;
            state = new State(s.principals(), s.subjects(), s.domainList(), s.forest(), s.outgoing(),
                    s.incoming(), s.endorsements(), appended(s.distrust(), distrust.from(), distrust));
        }
        fire(GraphChange.distrustEdge(distrust));
    }

    public Optional<Subject> subject(String id) {
        return Optional.ofNullable(state.subjects().get(id));
    }

    public int trustEdgeCount() {
        int n = 0;
        for (List<TrustEdge> l : state.outgoing().values())
            n += l.size();
        return n;
    }

    private static <T> Map<String, List<T>> appended(Map<String, List<T>> index, String key, T value) {
        Map<String, List<T>> next = new HashMap<>(index);
        List<T> list = new ArrayList<>(index.getOrDefault(key, List.of()));
        list.add(value);
        next.put(key, List.copyOf(list));
        return Map.copyOf(next);
    }

    private void fire(GraphChange change) {
        for (GraphChangeListener l : listeners) {
            try {
                l.onGraphChange(change);
            } catch (RuntimeException e) {
                log.error("Change listener failed for {}: {}", change, e.getMessage(), e);
            }
        }
    }

    // --- Snapshot ---

    private static final class Snapshot implements GraphSnapshot {
        private final State state;
        private volatile boolean closed;

        Snapshot(State state) {
            this.state = state;
        }

        @Override
        public List<TrustEdge> outgoingTrustEdges(String principalId, String domain) {
            return inScope(state.outgoing().get(principalId), domain);
        }

        @Override
        public List<TrustEdge> incomingTrustEdges(String principalId, String domain) {
            return inScope(state.incoming().get(principalId), domain);
        }

        @Override
        public List<Endorsement> incomingEndorsements(String subjectId, String domain) {
            return inScope(state.endorsements().get(subjectId), domain);
        }

        @Override
        public List<DistrustEdge> outgoingDistrustEdges(String principalId, String domain) {
            return inScope(state.distrust().get(principalId), domain);
        }

        @Override
        public Optional<String> publicKeyOf(String principalId) {
            return principalOf(principalId).map(Principal::publicKey);
        }

        @Override
        public Optional<Principal> principalOf(String principalId) {
            ensureOpen();
            return Optional.ofNullable(state.principals().get(principalId));
        }

        @Override
        public DomainForest domains() {
            ensureOpen();
            return state.forest();
        }

        @Override
        public void close() {
            closed = true;
        }

        private <T extends SignedRecord> List<T> inScope(List<T> records, String domain) {
            ensureOpen();
            if (records == null)
                return List.of();
            List<T> out = new ArrayList<>(records.size());
            for (T r : records) {
                if (state.forest().isAncestorOrSelf(r.domain(), domain))
                    out.add(r);
            }
            return out;
        }

        private void ensureOpen() {
            if (closed)
                throw new IllegalStateException("Snapshot is closed");
        }
    }
}
