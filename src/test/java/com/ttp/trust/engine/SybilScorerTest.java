package com.ttp.trust.engine;

import com.ttp.trust.TestGraph;
import com.ttp.trust.api.SybilFlag;
import com.ttp.trust.api.SybilSignal;
import com.ttp.trust.crypto.SignatureVerifier;
import com.ttp.trust.util.CompositeTrustListener;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.ttp.trust.TestGraph.NOW;
import static com.ttp.trust.engine.DecayAggregatorTest.path;
import static org.junit.Assert.*;

public class SybilScorerTest {
    private static final double EPS = 1e-9;

    private final SybilScorer scorer = new SybilScorer(new TrustEngineConfig.SybilConfig());

    @Test
    public void testIndependentPathsAreNotDiscounted() {
        List<ScoredPath> ranked = List.of(new ScoredPath(path("A", "B", "T"), 0.4),
                new ScoredPath(path("A", "C", "T"), 0.3));
        assertArrayEquals(new double[] { 1.0, 1.0 }, scorer.redundancyFactors(ranked), EPS);
    }

    @Test
    public void testSharedContributorDiscountsLaterPaths() {
        List<ScoredPath> ranked = List.of(new ScoredPath(path("A", "B", "C", "T"), 0.4),
                new ScoredPath(path("A", "B", "D", "T"), 0.3),
                new ScoredPath(path("A", "E", "T"), 0.2));
        double[] r = scorer.redundancyFactors(ranked);
        assertEquals(1.0, r[0], EPS);
        // B sits on both of the first two paths
        assertEquals(1.0 - 0.5 * 2.0 / 2.0, r[1], EPS);
        assertEquals(1.0, r[2], EPS);
    }

    @Test
    public void testLowerRankedPathNeverChangesEarlierFactors() {
        List<ScoredPath> base = List.of(new ScoredPath(path("A", "X", "T"), 0.35),
                new ScoredPath(path("A", "X", "M", "T"), 0.25),
                new ScoredPath(path("A", "Y", "T"), 0.18));
        List<ScoredPath> extended = new ArrayList<>(base);
        extended.add(new ScoredPath(path("A", "X", "N", "T"), 0.01));

        double[] before = scorer.redundancyFactors(base);
        double[] after = scorer.redundancyFactors(extended);
        assertArrayEquals(before, Arrays.copyOf(after, 3), 0.0);
        // X sits on three of the first four paths
        assertEquals(1.0 - 0.5 * 3.0 / 4.0, after[3], EPS);

        DecayAggregator aggregator = new DecayAggregator(new TrustEngineConfig());
        assertTrue(aggregator.aggregate(extended, after) > aggregator.aggregate(base, before));
    }

    private static SybilSignal signalOf(TestGraph g, String principal) {
        EdgeGate gate = new EdgeGate(g.store().openSnapshot(), new SignatureVerifier(), "food", 0.9, NOW,
                new CompositeTrustListener());
        return new SybilSignalProvider(gate, new TrustEngineConfig.SybilConfig()).signal(principal);
    }

    private static TestGraph star() {
        return new TestGraph().domain("food").domain("tech").principals("P", "A", "B", "C")
                .edge("P", "A", "food", 0.9).edge("P", "B", "food", 0.9).edge("P", "C", "food", 0.9);
    }

    @Test
    public void testClusterCoefficientOfClique() {
        TestGraph g = star()
                .edge("A", "B", "food", 0.9).edge("A", "C", "food", 0.9)
                .edge("B", "A", "food", 0.9).edge("B", "C", "food", 0.9)
                .edge("C", "A", "food", 0.9).edge("C", "B", "food", 0.9);
        SybilSignal s = signalOf(g, "P");
        assertEquals(1.0, s.clusterCoefficient(), EPS);
        assertTrue(s.has(SybilFlag.HIGH_CLUSTER_COEFFICIENT));
        // cluster 0.25 + velocity 0.2 * 3/40 + no inbound trust 0.15
        assertEquals(0.415, s.riskScore(), EPS);
    }

    @Test
    public void testClusterCoefficientOfStar() {
        TestGraph g = star();
        g.store().addTrustEdge(TestGraph.tampered(
                g.signedEdge("A", "B", "food", 0.9, NOW.minus(Duration.ofDays(1)), null)));
        g.edge("A", "B", "tech", 0.9);
        SybilSignal s = signalOf(g, "P");
        assertEquals(0.0, s.clusterCoefficient(), EPS);
        assertFalse(s.has(SybilFlag.HIGH_CLUSTER_COEFFICIENT));
        assertEquals(0.165, s.riskScore(), EPS);
    }

    @Test
    public void testPartialCluster() {
        TestGraph g = star().edge("A", "B", "food", 0.9).edge("B", "C", "food", 0.9);
        SybilSignal s = signalOf(g, "P");
        assertEquals(2.0 / 6.0, s.clusterCoefficient(), EPS);
        assertFalse(s.has(SybilFlag.HIGH_CLUSTER_COEFFICIENT));
        // C's neighbors are P and B, and P trusts B
        assertEquals(0.5, signalOf(g, "C").clusterCoefficient(), EPS);
        // A single neighbor has no cluster
        assertEquals(0.0, signalOf(star(), "A").clusterCoefficient(), EPS);
    }

    @Test
    public void testDirectPathsHaveNoContributors() {
        assertTrue(path("A", "T").contributors().isEmpty());
        List<ScoredPath> ranked = List.of(new ScoredPath(path("A", "T"), 0.63));
        assertEquals(1.0, scorer.confidence(ranked, null), EPS);
    }

    @Test
    public void testJaccard() {
        assertEquals(0.0, SybilScorer.jaccard(Set.of(), Set.of()), EPS);
        assertEquals(1.0 / 3.0, SybilScorer.jaccard(Set.of("B", "C"), Set.of("B", "D")), EPS);
        assertEquals(1.0, SybilScorer.jaccard(Set.of("B"), Set.of("B")), EPS);
        assertEquals(0.0, SybilScorer.jaccard(Set.of("B"), Set.of("C")), EPS);
    }

    @Test
    public void testDiversity() {
        assertEquals(0.0, SybilScorer.diversity(List.of(new ScoredPath(path("A", "B", "T"), 0.4))), EPS);
        List<ScoredPath> disjoint = List.of(new ScoredPath(path("A", "B", "T"), 0.4),
                new ScoredPath(path("A", "C", "T"), 0.3));
        assertEquals(1.0, SybilScorer.diversity(disjoint), EPS);
        List<ScoredPath> shared = List.of(new ScoredPath(path("A", "B", "C", "T"), 0.4),
                new ScoredPath(path("A", "B", "D", "T"), 0.3));
        assertEquals(2.0 / 3.0, SybilScorer.diversity(shared), EPS);
    }
}
