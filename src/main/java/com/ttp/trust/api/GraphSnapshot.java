package com.ttp.trust.api;

import com.ttp.trust.domain.DomainForest;

import java.util.List;
import java.util.Optional;

/**
 * A repeatable-read view of the trust graph, valid for one query.
 *
 * <p>
 * Edge lookups return records whose domain equals {@code domain} or is one of
 * its ancestors in the {@link #domains() domain forest}. Records are returned
 * as stored. Signature and expiry checks are the engine's job. Every method
 * may throw {@link PortUnavailableException}.
 */
public interface GraphSnapshot extends AutoCloseable {

    List<TrustEdge> outgoingTrustEdges(String principalId, String domain);

    List<TrustEdge> incomingTrustEdges(String principalId, String domain);

    List<Endorsement> incomingEndorsements(String subjectId, String domain);

    /** Distrust records issued by {@code principalId}. */
    List<DistrustEdge> outgoingDistrustEdges(String principalId, String domain);

    /** Registered public key of a principal, base64 encoded. */
    Optional<String> publicKeyOf(String principalId);

    Optional<Principal> principalOf(String principalId);

    DomainForest domains();

    /** Releases the read view. Does not throw checked exceptions. */
    @Override
    void close();
}
