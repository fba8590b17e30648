package com.ttp.trust.wiring;

import com.lmax.disruptor.EventHandler;
import com.ttp.trust.api.GraphChange;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Consumes {@link GraphChangeEvent}s and drives cache invalidation.
 *
 * <p>
 * Changes are coalesced while the Disruptor reports more events pending.
 * At {@code endOfBatch} the handler invalidates once per distinct domain, or
 * once in total if any change in the batch affects all domains. A burst of
 * thousands of edge writes therefore costs a handful of cache scans.
 */
public final class CacheInvalidationHandler implements EventHandler<GraphChangeEvent> {
    private static final Logger log = LogManager.getLogger(CacheInvalidationHandler.class);

    private final Consumer<GraphChange> invalidator;
    private final Map<String, GraphChange> pending = new LinkedHashMap<>();
    private GraphChange pendingAll;
    private int batchSize;

    private final Object progress = new Object();
    private long processedSequence = -1;
    private long batches;

    public CacheInvalidationHandler(Consumer<GraphChange> invalidator) {
        this.invalidator = invalidator;
    }

    @Override
    public void onEvent(GraphChangeEvent event, long sequence, boolean endOfBatch) {
        GraphChange change = event.toChange();
        event.clear();
        batchSize++;
        if (change.affectsAllDomains()) {
            if (pendingAll == null)
                pendingAll = change;
        } else {
            pending.putIfAbsent(change.domain(), change);
        }

        if (endOfBatch)
            drain(sequence);
    }

    private void drain(long sequence) {
        try {
            if (pendingAll != null) {
                invalidator.accept(pendingAll);
            } else {
                for (GraphChange change : pending.values())
                    invalidator.accept(change);
            }
            if (log.isDebugEnabled())
                log.debug("Applied {} graph changes ({} domains{})", batchSize, pending.size(),
                        pendingAll != null ? ", all" : "");
        } catch (RuntimeException e) {
            // Keep the consumer thread alive.
            log.error("Cache invalidation failed for batch ending at {}: {}", sequence, e.getMessage(), e);
        } finally {
            pending.clear();
            pendingAll = null;
            batchSize = 0;
            synchronized (progress) {
                processedSequence = sequence;
                batches++;
                progress.notifyAll();
            }
        }
    }

    public long processedSequence() {
        synchronized (progress) {
            return processedSequence;
        }
    }

    public long batches() {
        synchronized (progress) {
            return batches;
        }
    }

    /**
     * Blocks until {@code sequence} has been applied.
     *
     * @return false on timeout
     */
    public boolean awaitSequence(long sequence, long timeoutMillis) throws InterruptedException {
        long deadline = System.nanoTime() + timeoutMillis * 1_000_000L;
        synchronized (progress) {
            while (processedSequence < sequence) {
                long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMillis <= 0)
                    return false;
                progress.wait(remainingMillis);
            }
            return true;
        }
    }
}
