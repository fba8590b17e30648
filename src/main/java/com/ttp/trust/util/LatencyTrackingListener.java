package com.ttp.trust.util;

import com.ttp.trust.api.ExclusionReason;
import com.ttp.trust.api.SignedRecord;
import com.ttp.trust.api.TrustComputationListener;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tracks query performance.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> min, max and average time per query (nanoseconds).</li>
 * <li><b>Throughput:</b> total queries, cache hits, truncated results.</li>
 * <li><b>Errors:</b> failed queries, logged with a one-second throttle.</li>
 * </ul>
 */
public final class LatencyTrackingListener implements TrustComputationListener {
    private static final Logger log = LogManager.getLogger(LatencyTrackingListener.class);

    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000);
    private long lastLatencyNanos;
    private long totalQueries, totalLatencyNanos, cacheHits, truncated, errors;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;

    @Override
    public void onQueryStart(TrustQuery query) {
        // Duration is supplied at the end
    }

    @Override
    public synchronized void onCacheHit(TrustQuery query) {
        cacheHits++;
    }

    @Override
    public void onRecordExcluded(ExclusionReason reason, SignedRecord record) {
    }

    @Override
    public synchronized void onQueryEnd(TrustQuery query, TrustResult result, long durationNanos) {
        lastLatencyNanos = durationNanos;
        totalQueries++;
        totalLatencyNanos += durationNanos;
        if (result.isTruncated())
            truncated++;
        if (durationNanos < minLatencyNanos)
            minLatencyNanos = durationNanos;
        if (durationNanos > maxLatencyNanos)
            maxLatencyNanos = durationNanos;
    }

    @Override
    public void onQueryError(TrustQuery query, Throwable error) {
        synchronized (this) {
            errors++;
        }
        errLimiter.log(String.format("Trust query %s -> %s failed: %s", query.source(), query.target().id(),
                error.getMessage()), null);
    }

    public synchronized long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public synchronized long totalQueries() {
        return totalQueries;
    }

    public synchronized long cacheHits() {
        return cacheHits;
    }

    public synchronized long truncatedResults() {
        return truncated;
    }

    public synchronized long errors() {
        return errors;
    }

    public synchronized double avgLatencyNanos() {
        return totalQueries > 0 ? (double) totalLatencyNanos / totalQueries : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public synchronized long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public synchronized long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public synchronized void reset() {
        totalQueries = 0;
        totalLatencyNanos = 0;
        cacheHits = 0;
        truncated = 0;
        errors = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-16s | %10s | %10s | %10s | %10s\n", "Metric", "Value", "Avg (us)", "Min (us)",
                "Max (us)"));
        sb.append("----------------------------------------------------------------------\n");
        sb.append(String.format("%-16s | %10d | %10.2f | %10.2f | %10.2f\n", "Queries", totalQueries(),
                avgLatencyMicros(), minLatencyNanos() / 1000.0, maxLatencyNanos() / 1000.0));
        sb.append(String.format("%-16s | %10d |\n", "Cache hits", cacheHits()));
        sb.append(String.format("%-16s | %10d |\n", "Truncated", truncatedResults()));
        sb.append(String.format("%-16s | %10d |\n", "Errors", errors()));
        return sb.toString();
    }
}
