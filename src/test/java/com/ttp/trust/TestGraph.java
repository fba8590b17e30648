package com.ttp.trust;

import com.ttp.trust.api.DistrustEdge;
import com.ttp.trust.api.DistrustReason;
import com.ttp.trust.api.Domain;
import com.ttp.trust.api.Endorsement;
import com.ttp.trust.api.Principal;
import com.ttp.trust.api.PrincipalType;
import com.ttp.trust.api.Signature;
import com.ttp.trust.api.SignatureAlgorithm;
import com.ttp.trust.api.TrustEdge;
import com.ttp.trust.crypto.RecordSigner;
import com.ttp.trust.crypto.SigningKey;
import com.ttp.trust.store.InMemoryGraphStore;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Small builder for signed test graphs. Keys are derived from principal ids,
 * so the same id always signs with the same key.
 */
public final class TestGraph {
    public static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final InMemoryGraphStore store;
    private final Map<String, SigningKey> keys = new HashMap<>();

    public TestGraph() {
        this(new InMemoryGraphStore());
    }

    public TestGraph(InMemoryGraphStore store) {
        this.store = store;
    }

    public InMemoryGraphStore store() {
        return store;
    }

    public TestGraph domain(String id) {
        store.addDomain(Domain.root(id, id));
        return this;
    }

    public TestGraph domain(String id, String parent) {
        store.addDomain(Domain.child(id, parent, id));
        return this;
    }

    public TestGraph principals(String... ids) {
        for (String id : ids)
            principal(id, SignatureAlgorithm.ED25519, NOW.minus(Duration.ofDays(365)));
        return this;
    }

    public TestGraph principal(String id, SignatureAlgorithm algorithm, Instant createdAt) {
        SigningKey key = key(id, algorithm);
        store.addPrincipal(new Principal(id, PrincipalType.USER, key.publicKeyBase64(), createdAt));
        return this;
    }

    public TestGraph edge(String from, String to, String domain, double weight) {
        store.addTrustEdge(signedEdge(from, to, domain, weight, NOW.minus(Duration.ofDays(1)), null));
        return this;
    }

    public TrustEdge signedEdge(String from, String to, String domain, double weight, Instant issuedAt,
            Instant expiresAt) {
        TrustEdge edge = new TrustEdge(from, to, domain, weight, issuedAt, expiresAt, null);
        return signer(from).sign(edge);
    }

    public TestGraph endorse(String from, String subject, String domain, double weight) {
        store.addEndorsement(signedEndorsement(from, subject, domain, weight, NOW.minus(Duration.ofDays(1))));
        return this;
    }

    public Endorsement signedEndorsement(String from, String subject, String domain, double weight,
            Instant issuedAt) {
        return signer(from).sign(Endorsement.unsigned(from, subject, domain, weight, issuedAt));
    }

    public TestGraph distrust(String from, String to, String domain) {
        store.addDistrustEdge(signedDistrust(from, to, domain, NOW.minus(Duration.ofDays(1)), null));
        return this;
    }

    public DistrustEdge signedDistrust(String from, String to, String domain, Instant issuedAt, Instant expiresAt) {
        return signer(from).sign(new DistrustEdge(from, to, domain, DistrustReason.MALICIOUS, issuedAt, expiresAt,
                null));
    }

    public RecordSigner signer(String principalId) {
        return new RecordSigner(key(principalId, SignatureAlgorithm.ED25519), CLOCK);
    }

    public static TrustEdge tampered(TrustEdge edge) {
        return edge.withSignature(flipBit(edge.signature()));
    }

    public static Signature flipBit(Signature signature) {
        byte[] raw = Base64.getDecoder().decode(signature.signature());
        raw[raw.length / 2] ^= 0x10;
        return signature.withSignature(Base64.getEncoder().encodeToString(raw));
    }

    private SigningKey key(String id, SignatureAlgorithm algorithm) {
        return keys.computeIfAbsent(id, k -> SigningKey.fromSeed(algorithm, seed(k)));
    }

    public static byte[] seed(String id) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(("test-" + id).getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
