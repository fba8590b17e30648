package com.ttp.trust.util;

import com.ttp.trust.api.ExclusionReason;
import com.ttp.trust.api.SignedRecord;
import com.ttp.trust.api.TrustComputationListener;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;

import java.util.Arrays;

/**
 * Fans callbacks out to a copy-on-write array of listeners. Safe to call
 * from enumeration worker threads while listeners are being added.
 */
public class CompositeTrustListener implements TrustComputationListener {
    private volatile TrustComputationListener[] listeners = new TrustComputationListener[0];

    public synchronized void add(TrustComputationListener listener) {
        TrustComputationListener[] old = listeners;
        TrustComputationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized void remove(TrustComputationListener listener) {
        TrustComputationListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                TrustComputationListener[] next = new TrustComputationListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return;
            }
        }
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onQueryStart(TrustQuery query) {
        for (TrustComputationListener l : listeners)
            l.onQueryStart(query);
    }

    @Override
    public void onCacheHit(TrustQuery query) {
        for (TrustComputationListener l : listeners)
            l.onCacheHit(query);
    }

    @Override
    public void onRecordExcluded(ExclusionReason reason, SignedRecord record) {
        for (TrustComputationListener l : listeners)
            l.onRecordExcluded(reason, record);
    }

    @Override
    public void onQueryEnd(TrustQuery query, TrustResult result, long durationNanos) {
        for (TrustComputationListener l : listeners)
            l.onQueryEnd(query, result, durationNanos);
    }

    @Override
    public void onQueryError(TrustQuery query, Throwable error) {
        for (TrustComputationListener l : listeners)
            l.onQueryError(query, error);
    }
}
