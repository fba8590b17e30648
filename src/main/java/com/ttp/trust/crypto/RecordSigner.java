package com.ttp.trust.crypto;

import com.ttp.trust.api.DistrustEdge;
import com.ttp.trust.api.Endorsement;
import com.ttp.trust.api.Signature;
import com.ttp.trust.api.TrustEdge;

import java.time.Clock;
import java.util.Base64;

/**
 * Signs records with the shared {@link CanonicalEncoder}, so that whatever a
 * producer signs, {@link SignatureVerifier} checks over identical bytes.
 */
public final class RecordSigner {
    private final SigningKey key;
    private final Clock clock;

    public RecordSigner(SigningKey key) {
        this(key, Clock.systemUTC());
    }

    public RecordSigner(SigningKey key, Clock clock) {
        this.key = key;
        this.clock = clock;
    }

    public SigningKey key() {
        return key;
    }

    public TrustEdge sign(TrustEdge edge) {
        return edge.withSignature(signatureOver(CanonicalEncoder.encode(edge)));
    }

    public Endorsement sign(Endorsement endorsement) {
        return endorsement.withSignature(signatureOver(CanonicalEncoder.encode(endorsement)));
    }

    public DistrustEdge sign(DistrustEdge distrust) {
        return distrust.withSignature(signatureOver(CanonicalEncoder.encode(distrust)));
    }

    public Signature signatureOver(byte[] canonical) {
        return new Signature(key.algorithm(), key.publicKeyBase64(),
                Base64.getEncoder().encodeToString(key.sign(canonical)), clock.instant());
    }
}
