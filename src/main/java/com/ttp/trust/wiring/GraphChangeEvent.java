package com.ttp.trust.wiring;

import com.ttp.trust.api.GraphChange;

/**
 * Mutable ring-buffer slot carrying one {@link GraphChange}.
 *
 * <p>
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every change, so publishing allocates nothing beyond the change itself.
 */
public final class GraphChangeEvent {
    private GraphChange.Kind kind;
    private String domain;
    private String from;
    private String to;
    private long sequenceId;

    public void set(GraphChange change, long seqId) {
        this.kind = change.kind();
        this.domain = change.domain();
        this.from = change.from();
        this.to = change.to();
        this.sequenceId = seqId;
    }

    public GraphChange toChange() {
        return new GraphChange(kind, domain, from, to);
    }

    public GraphChange.Kind kind() {
        return kind;
    }

    public String domain() {
        return domain;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        kind = null;
        domain = null;
        from = null;
        to = null;
        sequenceId = 0;
    }
}
