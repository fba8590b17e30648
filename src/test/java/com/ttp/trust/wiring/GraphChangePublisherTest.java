package com.ttp.trust.wiring;

import com.ttp.trust.TestGraph;
import com.ttp.trust.api.GraphChange;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustTarget;
import com.ttp.trust.crypto.SignatureVerifier;
import com.ttp.trust.engine.TrustEngineConfig;
import com.ttp.trust.engine.TrustQueryEngine;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class GraphChangePublisherTest {

    @Test
    public void testChangesReachInvalidator() throws InterruptedException {
        List<GraphChange> applied = Collections.synchronizedList(new ArrayList<>());
        try (GraphChangePublisher publisher = new GraphChangePublisher(applied::add, 64)) {
            assertTrue(publisher.flush(100));
            for (int i = 0; i < 200; i++)
                publisher.onGraphChange(GraphChange.principal("p" + i));
            assertTrue(publisher.flush(5000));
            assertEquals(200, publisher.published());
            assertEquals(199, publisher.handler().processedSequence());
            assertFalse(applied.isEmpty());
            assertTrue(applied.size() <= 200);
        }
    }

    @Test
    public void testConcurrentWriters() throws InterruptedException {
        List<GraphChange> applied = Collections.synchronizedList(new ArrayList<>());
        try (GraphChangePublisher publisher = new GraphChangePublisher(applied::add)) {
            List<Thread> writers = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                String domain = "d" + t;
                Thread w = new Thread(() -> {
                    for (int i = 0; i < 500; i++)
                        publisher.onGraphChange(GraphChange.domain(domain));
                });
                writers.add(w);
                w.start();
            }
            for (Thread w : writers)
                w.join(5000);
            assertTrue(publisher.flush(5000));
            assertEquals(2000, publisher.published());
        }
    }

    @Test
    public void testStoreWritesInvalidateEngineCache() throws InterruptedException {
        TestGraph g = new TestGraph().domain("food").principals("A", "B", "C")
                .edge("A", "B", "food", 0.9)
                .edge("B", "C", "food", 0.8);
        TrustQueryEngine engine = new TrustQueryEngine(g.store(), new TrustEngineConfig(), new SignatureVerifier(),
                TestGraph.CLOCK);
        try (GraphChangePublisher publisher = new GraphChangePublisher(engine::invalidate)) {
            g.store().addChangeListener(publisher);
            TrustQuery q = TrustQuery.of("A", TrustTarget.principal("C"), "food");
            double before = engine.query(q).score();
            assertEquals(1, engine.cache().size());

            g.edge("A", "C", "food", 0.9);
            assertTrue(publisher.flush(5000));
            assertEquals(0, engine.cache().size());
            assertTrue(engine.query(q).score() > before);
        } finally {
            engine.close();
        }
    }
}
