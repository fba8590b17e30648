package com.ttp.trust.engine;

import com.ttp.trust.api.Endorsement;
import com.ttp.trust.api.TrustEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A verified chain of trust edges from the source, optionally closed by an
 * endorsement of the target subject.
 *
 * @param edges           trust edges in order, all admitted by the gate
 * @param edgeWeights     effective weight of each edge (inheritance applied)
 * @param endorsement     terminal endorsement, or null for principal targets
 * @param endorsementWeight effective weight of the endorsement
 */
public record CandidatePath(String source, List<TrustEdge> edges, double[] edgeWeights, Endorsement endorsement,
        double endorsementWeight) {

    public CandidatePath {
        edges = List.copyOf(edges);
        edgeWeights = edgeWeights.clone();
        if (edgeWeights.length != edges.size())
            throw new IllegalArgumentException("One weight per edge required");
    }

    /** Decay hop count: trust edges plus the terminal endorsement. */
    public int hops() {
        return edges.size() + (endorsement != null ? 1 : 0);
    }

    /** Product of effective weights, before decay. */
    public double weightProduct() {
        double p = 1.0;
        for (double w : edgeWeights)
            p *= w;
        if (endorsement != null)
            p *= endorsementWeight;
        return p;
    }

    /** Principal ids from source to the last principal, in order. */
    public List<String> principals() {
        List<String> out = new ArrayList<>(edges.size() + 1);
        out.add(source);
        for (TrustEdge e : edges)
            out.add(e.to());
        return Collections.unmodifiableList(out);
    }

    /**
     * Principals that vouch along this path: everyone except the source and a
     * target principal. For subject targets the endorser counts.
     */
    public Set<String> contributors() {
        Set<String> out = new LinkedHashSet<>();
        int last = endorsement != null ? edges.size() : edges.size() - 1;
        for (int i = 0; i < last; i++)
            out.add(edges.get(i).to());
        if (endorsement != null && !endorsement.from().equals(source))
            out.add(endorsement.from());
        return out;
    }

    /** Stable textual key used to break ranking ties. */
    public String pathKey() {
        String key = String.join(">", principals());
        return endorsement != null ? key + ">#" + endorsement.subject() : key;
    }
}
