package com.ttp.trust.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.ttp.trust.api.GraphChange;
import com.ttp.trust.api.GraphChangeListener;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Moves graph change signals off the writer's thread.
 *
 * <p>
 * Registered on the graph port as a {@link GraphChangeListener}. Each change
 * is copied into a multi-producer ring buffer; a single consumer thread runs
 * the {@link CacheInvalidationHandler}, which batches them. Writers never
 * wait on cache scans.
 */
public final class GraphChangePublisher implements GraphChangeListener, AutoCloseable {
    private static final Logger log = LogManager.getLogger(GraphChangePublisher.class);

    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final Disruptor<GraphChangeEvent> disruptor;
    private final RingBuffer<GraphChangeEvent> ringBuffer;
    private final CacheInvalidationHandler handler;
    private final AtomicLong lastPublished = new AtomicLong(-1);
    private volatile boolean closed;

    public GraphChangePublisher(Consumer<GraphChange> invalidator) {
        this(invalidator, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize ring size, a power of two
     */
    public GraphChangePublisher(Consumer<GraphChange> invalidator, int bufferSize) {
        this.handler = new CacheInvalidationHandler(invalidator);
        this.disruptor = new Disruptor<>(
                GraphChangeEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(handler);
        this.ringBuffer = disruptor.start();
        log.info("Graph change publisher started (buffer={})", bufferSize);
    }

    @Override
    public void onGraphChange(GraphChange change) {
        if (closed) {
            log.warn("Dropping graph change after close: {}", change);
            return;
        }
        long sequence = ringBuffer.next();
        try {
            ringBuffer.get(sequence).set(change, sequence);
        } finally {
            ringBuffer.publish(sequence);
        }
        lastPublished.accumulateAndGet(sequence, Math::max);
    }

    /**
     * Waits until every change published so far has been applied.
     *
     * @return false if the timeout elapsed first
     */
    public boolean flush(long timeoutMillis) throws InterruptedException {
        long target = lastPublished.get();
        if (target < 0)
            return true;
        return handler.awaitSequence(target, timeoutMillis);
    }

    public CacheInvalidationHandler handler() {
        return handler;
    }

    public long published() {
        return lastPublished.get() + 1;
    }

    @Override
    public void close() {
        closed = true;
        try {
            disruptor.shutdown(5, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("Change ring did not drain within 5s, halting");
            disruptor.halt();
        }
    }
}
