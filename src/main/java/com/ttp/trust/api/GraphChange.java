package com.ttp.trust.api;

/**
 * A mutation signal from the storage layer.
 *
 * @param kind   what changed
 * @param domain affected domain, or null when every domain may be affected
 * @param from   signer of the changed record, when known
 * @param to     target of the changed record, when known
 */
public record GraphChange(Kind kind, String domain, String from, String to) {

    public enum Kind {
        TRUST_EDGE, ENDORSEMENT, DISTRUST_EDGE, PRINCIPAL, DOMAIN
    }

    public static GraphChange trustEdge(TrustEdge edge) {
        return new GraphChange(Kind.TRUST_EDGE, edge.domain(), edge.from(), edge.to());
    }

    public static GraphChange endorsement(Endorsement e) {
        return new GraphChange(Kind.ENDORSEMENT, e.domain(), e.from(), e.subject());
    }

    public static GraphChange distrustEdge(DistrustEdge d) {
        return new GraphChange(Kind.DISTRUST_EDGE, d.domain(), d.from(), d.to());
    }

    public static GraphChange principal(String principalId) {
        return new GraphChange(Kind.PRINCIPAL, null, principalId, null);
    }

    public static GraphChange domain(String domainId) {
        return new GraphChange(Kind.DOMAIN, domainId, null, null);
    }

    /** True when the change cannot be narrowed to a single domain. */
    public boolean affectsAllDomains() {
        return domain == null || Domain.WILDCARD.equals(domain) || kind == Kind.PRINCIPAL || kind == Kind.DOMAIN;
    }
}
