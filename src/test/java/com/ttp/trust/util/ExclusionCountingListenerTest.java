package com.ttp.trust.util;

import com.ttp.trust.TestGraph;
import com.ttp.trust.api.ExclusionReason;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustTarget;
import com.ttp.trust.crypto.SignatureVerifier;
import com.ttp.trust.engine.TrustEngineConfig;
import com.ttp.trust.engine.TrustQueryEngine;
import org.junit.Test;

import java.time.Duration;
import java.util.Map;

import static com.ttp.trust.TestGraph.NOW;
import static org.junit.Assert.*;

public class ExclusionCountingListenerTest {

    @Test
    public void testCountsAcrossQueries() {
        TestGraph g = new TestGraph().domain("food").principals("A", "B", "C");
        g.store().addTrustEdge(TestGraph.tampered(
                g.signedEdge("A", "B", "food", 0.9, NOW.minus(Duration.ofDays(1)), null)));
        g.store().addTrustEdge(g.signedEdge("A", "C", "food", 0.9, NOW.minus(Duration.ofDays(9)),
                NOW.minus(Duration.ofDays(2))));

        ExclusionCountingListener counter = new ExclusionCountingListener();
        TrustEngineConfig config = new TrustEngineConfig();
        config.setCacheMaxEntries(0);
        try (TrustQueryEngine engine = new TrustQueryEngine(g.store(), config, new SignatureVerifier(),
                TestGraph.CLOCK)) {
            engine.addListener(counter);
            engine.query(TrustQuery.of("A", TrustTarget.principal("B"), "food"));
            engine.query(TrustQuery.of("A", TrustTarget.principal("C"), "food"));
        }

        assertEquals(2, counter.count(ExclusionReason.INVALID_SIGNATURE));
        assertEquals(2, counter.count(ExclusionReason.EXPIRED));
        assertEquals(4, counter.total());
        Map<ExclusionReason, Long> snapshot = counter.snapshot();
        assertEquals(Long.valueOf(0), snapshot.get(ExclusionReason.UNKNOWN_SIGNER));

        counter.reset();
        assertEquals(0, counter.total());
    }
}
