package com.ttp.trust.engine;

import com.ttp.trust.api.Domain;
import com.ttp.trust.api.GraphChange;
import com.ttp.trust.api.QueryStats;
import com.ttp.trust.api.Truncation;
import com.ttp.trust.api.TrustEdge;
import com.ttp.trust.api.TrustResult;
import com.ttp.trust.api.TrustTarget;
import com.ttp.trust.domain.DomainForest;
import org.junit.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class ResultCacheTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Runnable NO_HIT = () -> {
    };

    private static ResultCache.Key key(String source, String domain) {
        return new ResultCache.Key(source, TrustTarget.principal("T"), domain, 4);
    }

    private static TrustResult result(double score) {
        return new TrustResult(score, 1.0, List.of(), NOW, Truncation.NONE, false, QueryStats.EMPTY);
    }

    @Test
    public void testHitAfterMiss() {
        ResultCache cache = new ResultCache(10, 60);
        AtomicInteger loads = new AtomicInteger();
        AtomicInteger hits = new AtomicInteger();
        TrustResult first = cache.get(key("A", "food"), () -> {
            loads.incrementAndGet();
            return result(0.5);
        }, hits::incrementAndGet);
        TrustResult second = cache.get(key("A", "food"), () -> {
            loads.incrementAndGet();
            return result(0.9);
        }, hits::incrementAndGet);

        assertSame(first, second);
        assertEquals(1, loads.get());
        assertEquals(1, hits.get());
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
    }

    @Test
    public void testConcurrentCallersShareOneComputation() throws Exception {
        ResultCache cache = new ResultCache(10, 60);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger loads = new AtomicInteger();
        AtomicReference<TrustResult> fromFirst = new AtomicReference<>();
        AtomicReference<TrustResult> fromSecond = new AtomicReference<>();

        Thread first = new Thread(() -> fromFirst.set(cache.get(key("A", "food"), () -> {
            loads.incrementAndGet();
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return result(0.5);
        }, NO_HIT)));
        first.start();
        assertTrue(started.await(5, TimeUnit.SECONDS));

        Thread second = new Thread(() -> fromSecond.set(cache.get(key("A", "food"), () -> {
            loads.incrementAndGet();
            return result(0.9);
        }, NO_HIT)));
        second.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (cache.hits() == 0 && System.currentTimeMillis() < deadline)
            Thread.sleep(5);
        release.countDown();
        first.join(5000);
        second.join(5000);

        assertEquals(1, loads.get());
        assertSame(fromFirst.get(), fromSecond.get());
        assertEquals(0.5, fromSecond.get().score(), 0.0);
    }

    @Test
    public void testEntriesExpire() {
        AtomicLong clock = new AtomicLong();
        ResultCache cache = new ResultCache(10, 10, clock::get);
        AtomicInteger loads = new AtomicInteger();
        cache.get(key("A", "food"), () -> result(loads.incrementAndGet()), NO_HIT);
        clock.addAndGet(TimeUnit.SECONDS.toNanos(9));
        cache.get(key("A", "food"), () -> result(loads.incrementAndGet()), NO_HIT);
        assertEquals(1, loads.get());

        clock.addAndGet(TimeUnit.SECONDS.toNanos(2));
        TrustResult fresh = cache.get(key("A", "food"), () -> result(loads.incrementAndGet()), NO_HIT);
        assertEquals(2, loads.get());
        assertEquals(2.0, fresh.score(), 0.0);
    }

    @Test
    public void testOldestEntryEvicted() {
        AtomicLong clock = new AtomicLong();
        ResultCache cache = new ResultCache(2, 60, clock::get);
        for (String source : List.of("A", "B", "C")) {
            clock.incrementAndGet();
            cache.get(key(source, "food"), () -> result(0.5), NO_HIT);
        }
        assertEquals(2, cache.size());
        assertEquals(1, cache.evictions());

        AtomicInteger loads = new AtomicInteger();
        cache.get(key("C", "food"), () -> result(loads.incrementAndGet()), NO_HIT);
        assertEquals(0, loads.get());
        cache.get(key("A", "food"), () -> result(loads.incrementAndGet()), NO_HIT);
        assertEquals(1, loads.get());
    }

    @Test
    public void testTruncatedResultsNotRetained() {
        ResultCache cache = new ResultCache(10, 60);
        TrustResult partial = new TrustResult(0.3, 0.5, List.of(), NOW, Truncation.NODE_BUDGET, false,
                QueryStats.EMPTY);
        assertSame(partial, cache.get(key("A", "food"), () -> partial, NO_HIT));
        assertEquals(0, cache.size());
    }

    @Test
    public void testFailuresNotRetained() {
        ResultCache cache = new ResultCache(10, 60);
        try {
            cache.get(key("A", "food"), () -> {
                throw new IllegalStateException("boom");
            }, NO_HIT);
            fail("expected IllegalStateException");
        } catch (IllegalStateException expected) {
            assertEquals("boom", expected.getMessage());
        }
        assertEquals(0, cache.size());
        assertEquals(0.5, cache.get(key("A", "food"), () -> result(0.5), NO_HIT).score(), 0.0);
    }

    @Test
    public void testDisabledCacheAlwaysLoads() {
        ResultCache cache = new ResultCache(0, 60);
        AtomicInteger loads = new AtomicInteger();
        cache.get(key("A", "food"), () -> result(loads.incrementAndGet()), NO_HIT);
        cache.get(key("A", "food"), () -> result(loads.incrementAndGet()), NO_HIT);
        assertEquals(2, loads.get());
        assertEquals(0, cache.size());
    }

    @Test
    public void testInvalidationCoversDescendantDomains() {
        DomainForest forest = DomainForest.builder()
                .add(Domain.root("food", "Food"))
                .add(Domain.child("food.restaurants", "food", "Restaurants"))
                .add(Domain.root("tech", "Tech"))
                .build();
        ResultCache cache = new ResultCache(10, 60);
        cache.get(key("A", "food"), () -> result(0.1), NO_HIT);
        cache.get(key("A", "food.restaurants"), () -> result(0.2), NO_HIT);
        cache.get(key("A", "tech"), () -> result(0.3), NO_HIT);

        TrustEdge edge = TrustEdge.unsigned("X", "Y", "food", 0.5, NOW);
        assertEquals(2, cache.invalidate(GraphChange.trustEdge(edge), forest));
        assertEquals(1, cache.size());

        TrustEdge leaf = TrustEdge.unsigned("X", "Y", "food.restaurants", 0.5, NOW);
        cache.get(key("A", "food"), () -> result(0.1), NO_HIT);
        assertEquals(0, cache.invalidate(GraphChange.trustEdge(leaf), forest));
        assertEquals(2, cache.size());

        assertEquals(2, cache.invalidate(GraphChange.principal("X"), forest));
        assertEquals(0, cache.size());
    }
}
