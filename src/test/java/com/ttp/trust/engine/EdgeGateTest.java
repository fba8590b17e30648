package com.ttp.trust.engine;

import com.ttp.trust.TestGraph;
import com.ttp.trust.api.DistrustEdge;
import com.ttp.trust.api.Endorsement;
import com.ttp.trust.api.ExclusionReason;
import com.ttp.trust.api.GraphSnapshot;
import com.ttp.trust.api.Principal;
import com.ttp.trust.api.SignedRecord;
import com.ttp.trust.api.TrustComputationListener;
import com.ttp.trust.api.TrustEdge;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;
import com.ttp.trust.crypto.SignatureVerifier;
import com.ttp.trust.domain.DomainForest;
import com.ttp.trust.engine.EdgeGate.WeightedEdge;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.ttp.trust.TestGraph.NOW;
import static org.junit.Assert.*;

public class EdgeGateTest {
    private static final double EPS = 1e-9;

    /** Serves everything from the store, plus records the store would have filtered. */
    private static final class LeakySnapshot implements GraphSnapshot {
        final GraphSnapshot delegate;
        final List<TrustEdge> extraOutgoing = new ArrayList<>();

        LeakySnapshot(GraphSnapshot delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<TrustEdge> outgoingTrustEdges(String principalId, String domain) {
            List<TrustEdge> out = new ArrayList<>(delegate.outgoingTrustEdges(principalId, domain));
            for (TrustEdge e : extraOutgoing) {
                if (e.from().equals(principalId))
                    out.add(e);
            }
            return out;
        }

        @Override
        public List<TrustEdge> incomingTrustEdges(String principalId, String domain) {
            return delegate.incomingTrustEdges(principalId, domain);
        }

        @Override
        public List<Endorsement> incomingEndorsements(String subjectId, String domain) {
            return delegate.incomingEndorsements(subjectId, domain);
        }

        @Override
        public List<DistrustEdge> outgoingDistrustEdges(String principalId, String domain) {
            return delegate.outgoingDistrustEdges(principalId, domain);
        }

        @Override
        public Optional<String> publicKeyOf(String principalId) {
            return delegate.publicKeyOf(principalId);
        }

        @Override
        public Optional<Principal> principalOf(String principalId) {
            return delegate.principalOf(principalId);
        }

        @Override
        public DomainForest domains() {
            return delegate.domains();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }

    private static final class RecordingListener implements TrustComputationListener {
        final List<ExclusionReason> reasons = new ArrayList<>();

        @Override
        public void onQueryStart(TrustQuery query) {
        }

        @Override
        public synchronized void onRecordExcluded(ExclusionReason reason, SignedRecord record) {
            reasons.add(reason);
        }

        @Override
        public void onQueryEnd(TrustQuery query, TrustResult result, long durationNanos) {
        }

        @Override
        public void onQueryError(TrustQuery query, Throwable error) {
        }
    }

    @Test
    public void testForeignDomainRecordIsMismatch() {
        TestGraph g = new TestGraph().domain("food").domain("tech").principals("A", "B", "C")
                .edge("A", "B", "food", 0.8);
        LeakySnapshot snapshot = new LeakySnapshot(g.store().openSnapshot());
        snapshot.extraOutgoing.add(g.signedEdge("A", "C", "tech", 0.9, NOW.minus(Duration.ofDays(1)), null));
        RecordingListener listener = new RecordingListener();

        EdgeGate gate = new EdgeGate(snapshot, new SignatureVerifier(), "food", 0.9, NOW, listener);
        List<WeightedEdge> out = gate.outgoing("A");
        assertEquals(1, out.size());
        assertEquals("B", out.get(0).edge().to());
        assertEquals(List.of(ExclusionReason.DOMAIN_MISMATCH), listener.reasons);
        assertEquals(Integer.valueOf(1), gate.exclusions().get(ExclusionReason.DOMAIN_MISMATCH));
    }

    @Test
    public void testEachRecordJudgedOnce() {
        TestGraph g = new TestGraph().domain("food").principals("A", "B");
        g.store().addTrustEdge(TestGraph.tampered(
                g.signedEdge("A", "B", "food", 0.9, NOW.minus(Duration.ofDays(1)), null)));
        RecordingListener listener = new RecordingListener();
        EdgeGate gate = new EdgeGate(g.store().openSnapshot(), new SignatureVerifier(), "food", 0.9, NOW, listener);

        assertTrue(gate.outgoing("A").isEmpty());
        assertTrue(gate.incoming("B").isEmpty());
        assertEquals(2, gate.edgesExamined());
        assertEquals(List.of(ExclusionReason.INVALID_SIGNATURE), listener.reasons);
        assertEquals(Integer.valueOf(1), gate.exclusions().get(ExclusionReason.INVALID_SIGNATURE));
    }

    @Test
    public void testLivenessWindowBoundaries() {
        TestGraph g = new TestGraph().domain("food").principals("A", "B", "C", "D");
        g.store().addTrustEdge(g.signedEdge("A", "B", "food", 0.9, NOW, null));
        g.store().addTrustEdge(g.signedEdge("A", "C", "food", 0.8, NOW.minus(Duration.ofDays(1)), NOW));
        g.store().addTrustEdge(g.signedEdge("A", "D", "food", 0.7, NOW.plusMillis(1), null));
        RecordingListener listener = new RecordingListener();
        EdgeGate gate = new EdgeGate(g.store().openSnapshot(), new SignatureVerifier(), "food", 0.9, NOW, listener);

        List<WeightedEdge> out = gate.outgoing("A");
        assertEquals(1, out.size());
        assertEquals("B", out.get(0).edge().to());
        assertEquals(Integer.valueOf(1), gate.exclusions().get(ExclusionReason.EXPIRED));
        assertEquals(Integer.valueOf(1), gate.exclusions().get(ExclusionReason.NOT_YET_VALID));
        assertEquals(2, listener.reasons.size());
    }

    @Test
    public void testOutgoingOrderAndInheritedWeight() {
        TestGraph g = new TestGraph().domain("food").domain("food.restaurants", "food")
                .principals("A", "B", "C", "D")
                .edge("A", "D", "food.restaurants", 0.5)
                .edge("A", "C", "food", 0.9)
                .edge("A", "B", "food.restaurants", 0.6);
        EdgeGate gate = new EdgeGate(g.store().openSnapshot(), new SignatureVerifier(), "food.restaurants", 0.9,
                NOW, new RecordingListener());
        List<WeightedEdge> out = gate.outgoing("A");
        assertEquals(3, out.size());
        // C is inherited from food and discounted once
        assertEquals("C", out.get(0).edge().to());
        assertEquals(0.81, out.get(0).weight(), EPS);
        assertEquals("B", out.get(1).edge().to());
        assertEquals(0.6, out.get(1).weight(), EPS);
        assertEquals("D", out.get(2).edge().to());
    }

    @Test
    public void testEndorsementSupersededByNewer() {
        TestGraph g = new TestGraph().domain("food").principals("A");
        g.store().addEndorsement(g.signedEndorsement("A", "diner", "food", 0.9, NOW.minus(Duration.ofDays(5))));
        g.store().addEndorsement(g.signedEndorsement("A", "diner", "food", 0.3, NOW.minus(Duration.ofDays(1))));
        EdgeGate gate = new EdgeGate(g.store().openSnapshot(), new SignatureVerifier(), "food", 0.9, NOW,
                new RecordingListener());
        assertEquals(0.3, gate.endorsement("A", "diner").orElseThrow().weight(), EPS);
        assertTrue(gate.endorsement("B", "diner").isEmpty());
    }
}
