package com.ttp.trust.util;

import com.ttp.trust.api.ExclusionReason;
import com.ttp.trust.api.SignedRecord;
import com.ttp.trust.api.TrustComputationListener;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLongArray;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Running totals of excluded records per {@link ExclusionReason}, across all
 * queries. Invalid signatures are logged (throttled) since they point at
 * forged or corrupted records rather than ordinary expiry.
 */
public final class ExclusionCountingListener implements TrustComputationListener {
    private static final Logger log = LogManager.getLogger(ExclusionCountingListener.class);

    private final AtomicLongArray counts = new AtomicLongArray(ExclusionReason.values().length);
    private final ErrorRateLimiter forgeryLog = new ErrorRateLimiter(log, 1000);

    @Override
    public void onQueryStart(TrustQuery query) {
    }

    @Override
    public void onRecordExcluded(ExclusionReason reason, SignedRecord record) {
        counts.incrementAndGet(reason.ordinal());
        if (reason == ExclusionReason.INVALID_SIGNATURE)
            forgeryLog.log("Rejected record with invalid signature: " + record, null);
    }

    @Override
    public void onQueryEnd(TrustQuery query, TrustResult result, long durationNanos) {
    }

    @Override
    public void onQueryError(TrustQuery query, Throwable error) {
    }

    public long count(ExclusionReason reason) {
        return counts.get(reason.ordinal());
    }

    public long total() {
        long total = 0;
        for (int i = 0; i < counts.length(); i++)
            total += counts.get(i);
        return total;
    }

    public Map<ExclusionReason, Long> snapshot() {
        Map<ExclusionReason, Long> out = new EnumMap<>(ExclusionReason.class);
        for (ExclusionReason r : ExclusionReason.values())
            out.put(r, counts.get(r.ordinal()));
        return out;
    }

    public void reset() {
        for (int i = 0; i < counts.length(); i++)
            counts.set(i, 0);
    }
}
