package com.ttp.trust.wiring;

import com.ttp.trust.api.GraphChange;
import com.ttp.trust.api.TrustEdge;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CacheInvalidationHandlerTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private final List<GraphChange> applied = new ArrayList<>();
    private final CacheInvalidationHandler handler = new CacheInvalidationHandler(applied::add);

    private void deliver(GraphChange change, long sequence, boolean endOfBatch) {
        GraphChangeEvent event = new GraphChangeEvent();
        event.set(change, sequence);
        handler.onEvent(event, sequence, endOfBatch);
    }

    private static GraphChange edge(String from, String to, String domain) {
        return GraphChange.trustEdge(TrustEdge.unsigned(from, to, domain, 0.5, NOW));
    }

    @Test
    public void testBatchCoalescedPerDomain() {
        deliver(edge("A", "B", "food"), 0, false);
        deliver(edge("A", "C", "food"), 1, false);
        deliver(edge("A", "D", "tech"), 2, false);
        assertTrue(applied.isEmpty());
        deliver(edge("B", "C", "food"), 3, true);

        assertEquals(2, applied.size());
        assertEquals("food", applied.get(0).domain());
        assertEquals("tech", applied.get(1).domain());
        assertEquals(3, handler.processedSequence());
        assertEquals(1, handler.batches());
    }

    @Test
    public void testGlobalChangeSupersedesDomains() {
        deliver(edge("A", "B", "food"), 0, false);
        deliver(GraphChange.principal("A"), 1, false);
        deliver(edge("A", "D", "tech"), 2, true);

        assertEquals(1, applied.size());
        assertTrue(applied.get(0).affectsAllDomains());
    }

    @Test
    public void testFailingInvalidatorDoesNotStopProgress() throws InterruptedException {
        CacheInvalidationHandler failing = new CacheInvalidationHandler(c -> {
            throw new IllegalStateException("cache gone");
        });
        GraphChangeEvent event = new GraphChangeEvent();
        event.set(edge("A", "B", "food"), 0);
        failing.onEvent(event, 0, true);
        assertEquals(0, failing.processedSequence());
        assertTrue(failing.awaitSequence(0, 10));
    }

    @Test
    public void testAwaitTimesOut() throws InterruptedException {
        assertFalse(handler.awaitSequence(5, 20));
    }
}
