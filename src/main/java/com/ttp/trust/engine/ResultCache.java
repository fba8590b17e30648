package com.ttp.trust.engine;

import com.ttp.trust.api.GraphChange;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;
import com.ttp.trust.api.TrustTarget;
import com.ttp.trust.domain.DomainForest;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Single-flight result cache.
 *
 * <p>
 * Concurrent lookups of the same key share one computation. Entries live for
 * the configured TTL; once the cache is full the oldest entry goes first.
 * Truncated results and failures are handed to the waiting callers but are
 * never retained.
 */
public final class ResultCache {

    /** Cache key; the depth is the effective (clamped) one. */
    public record Key(String source, TrustTarget target, String domain, int maxDepth) {
        public static Key of(TrustQuery query, int effectiveDepth) {
            return new Key(query.source(), query.target(), query.domain(), effectiveDepth);
        }
    }

    private static final class Entry {
        final CompletableFuture<TrustResult> future = new CompletableFuture<>();
        final long createdNanos;

        Entry(long createdNanos) {
            this.createdNanos = createdNanos;
        }
    }

    private final Map<Key, Entry> entries = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final long ttlNanos;
    private final LongSupplier nanoClock;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public ResultCache(int maxEntries, long ttlSeconds) {
        this(maxEntries, ttlSeconds, System::nanoTime);
    }

    ResultCache(int maxEntries, long ttlSeconds, LongSupplier nanoClock) {
        this.maxEntries = maxEntries;
        this.ttlNanos = TimeUnit.SECONDS.toNanos(ttlSeconds);
        this.nanoClock = nanoClock;
    }

    /**
     * Returns the cached result for {@code key}, joining an in-flight
     * computation if there is one, or runs {@code loader}.
     *
     * @param onHit run when the result came from the cache or another caller
     */
    public TrustResult get(Key key, Supplier<TrustResult> loader, Runnable onHit) {
        if (maxEntries == 0) {
            misses.incrementAndGet();
            return loader.get();
        }
        while (true) {
            long now = nanoClock.getAsLong();
            Entry existing = entries.get(key);
            if (existing != null) {
                if (now - existing.createdNanos < ttlNanos) {
                    hits.incrementAndGet();
                    onHit.run();
                    return join(existing.future);
                }
                entries.remove(key, existing);
                continue;
            }

            Entry mine = new Entry(now);
            if (entries.putIfAbsent(key, mine) != null)
                continue;
            misses.incrementAndGet();

            TrustResult result;
            try {
                result = loader.get();
            } catch (RuntimeException | Error e) {
                entries.remove(key, mine);
                mine.future.completeExceptionally(e);
                throw e;
            }
            if (result.isTruncated())
                entries.remove(key, mine);
            mine.future.complete(result);
            evictOverflow();
            return result;
        }
    }

    /**
     * Drops entries whose query domain is the changed domain or one of its
     * descendants. Changes that affect all domains clear the cache.
     */
    public int invalidate(GraphChange change, DomainForest forest) {
        if (change.affectsAllDomains()) {
            int n = entries.size();
            entries.clear();
            return n;
        }
        int removed = 0;
        Iterator<Key> it = entries.keySet().iterator();
        while (it.hasNext()) {
            Key k = it.next();
            if (k.domain().equals(change.domain()) || forest.isAncestorOrSelf(change.domain(), k.domain())) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    public long evictions() {
        return evictions.get();
    }

    private void evictOverflow() {
        while (entries.size() > maxEntries) {
            Map.Entry<Key, Entry> oldest = null;
            for (Map.Entry<Key, Entry> e : entries.entrySet()) {
                if (oldest == null || e.getValue().createdNanos - oldest.getValue().createdNanos < 0)
                    oldest = e;
            }
            if (oldest == null)
                return;
            if (entries.remove(oldest.getKey(), oldest.getValue()))
                evictions.incrementAndGet();
        }
    }

    private static TrustResult join(CompletableFuture<TrustResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException("Interrupted waiting for shared computation", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re)
                throw re;
            if (cause instanceof Error err)
                throw err;
            throw new CompletionException(cause);
        }
    }
}
