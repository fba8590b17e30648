package com.ttp.trust.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ttp.trust.api.DistrustEdge;
import com.ttp.trust.api.DistrustReason;
import com.ttp.trust.api.Domain;
import com.ttp.trust.api.Endorsement;
import com.ttp.trust.api.Principal;
import com.ttp.trust.api.PrincipalType;
import com.ttp.trust.api.Signature;
import com.ttp.trust.api.SignatureAlgorithm;
import com.ttp.trust.api.Subject;
import com.ttp.trust.api.SubjectType;
import com.ttp.trust.api.TrustEdge;
import com.ttp.trust.crypto.RecordSigner;
import com.ttp.trust.crypto.SigningKey;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Loads a {@link GraphFixture} into an {@link InMemoryGraphStore}, signing
 * every record with its issuer's key.
 */
@Log4j2
public final class GraphFixtureLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, SigningKey> keys = new LinkedHashMap<>();

    public GraphFixtureLoader() {
        this(Clock.systemUTC());
    }

    public GraphFixtureLoader(Clock clock) {
        this.clock = clock;
    }

    public static GraphFixture parse(InputStream in) throws IOException {
        return MAPPER.readValue(in, GraphFixture.class);
    }

    public static GraphFixture parse(String json) {
        try {
            return MAPPER.readValue(json, GraphFixture.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid graph fixture: " + e.getMessage(), e);
        }
    }

    /** Loads a classpath resource such as {@code /demo-graph.json}. */
    public InMemoryGraphStore loadResource(String resource) {
        try (InputStream in = GraphFixtureLoader.class.getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Fixture not found on classpath: " + resource);
            InMemoryGraphStore store = new InMemoryGraphStore();
            load(parse(in), store);
            return store;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read fixture " + resource, e);
        }
    }

    public InMemoryGraphStore loadFile(Path path) throws IOException {
        InMemoryGraphStore store = new InMemoryGraphStore();
        try (InputStream in = Files.newInputStream(path)) {
            load(parse(in), store);
        }
        return store;
    }

    /**
     * Writes the fixture into {@code store}: domains first, then principals,
     * subjects and finally the signed records (trust edges, endorsements and
     * distrust edges).
     */
    public void load(GraphFixture fixture, InMemoryGraphStore store) {
        List<Domain> domains = new ArrayList<>();
        for (GraphFixture.DomainDef d : fixture.getDomains())
            domains.add(new Domain(d.getId(), d.getParent(), d.getName()));
        store.addDomains(domains);

        for (GraphFixture.PrincipalDef p : fixture.getPrincipals()) {
            SignatureAlgorithm alg = SignatureAlgorithm.fromString(p.getAlgorithm());
            SigningKey key = p.getSeed() != null
                    ? SigningKey.fromSeedHex(alg, p.getSeed())
                    : SigningKey.generate(alg, random);
            keys.put(p.getId(), key);
            store.addPrincipal(new Principal(p.getId(), PrincipalType.valueOf(p.getType().toUpperCase(Locale.ROOT)),
                    key.publicKeyBase64(), instant(p.getCreatedAt())));
        }

        for (GraphFixture.SubjectDef s : fixture.getSubjects()) {
            store.addSubject(new Subject(s.getId(), SubjectType.valueOf(s.getType().toUpperCase(Locale.ROOT)),
                    s.getDomains() == null ? null : new HashSet<>(s.getDomains()), null,
                    s.getExternalIds()));
        }

        for (GraphFixture.EdgeDef e : fixture.getTrustEdges()) {
            TrustEdge edge = new TrustEdge(e.getFrom(), e.getTo(), e.getDomain(), e.getWeight(),
                    instant(e.getIssuedAt()), instant(e.getExpiresAt()), null);
            edge = signerFor(e.getFrom()).sign(edge);
            if (e.isTampered())
                edge = edge.withSignature(tamper(edge.signature()));
            store.addTrustEdge(edge);
        }

        for (GraphFixture.EndorsementDef e : fixture.getEndorsements()) {
            Endorsement endorsement = new Endorsement(e.getFrom(), e.getSubject(), e.getDomain(), e.getWeight(),
                    instant(e.getIssuedAt()), instant(e.getExpiresAt()), null);
            endorsement = signerFor(e.getFrom()).sign(endorsement);
            if (e.isTampered())
                endorsement = endorsement.withSignature(tamper(endorsement.signature()));
            store.addEndorsement(endorsement);
        }

        for (GraphFixture.DistrustDef d : fixture.getDistrustEdges()) {
            DistrustEdge distrust = new DistrustEdge(d.getFrom(), d.getTo(), d.getDomain(),
                    DistrustReason.fromString(d.getReason()), instant(d.getIssuedAt()), instant(d.getExpiresAt()),
                    null);
            distrust = signerFor(d.getFrom()).sign(distrust);
            if (d.isTampered())
                distrust = distrust.withSignature(tamper(distrust.signature()));
            store.addDistrustEdge(distrust);
        }

        log.info("Loaded fixture '{}': {} domains, {} principals, {} edges, {} endorsements, {} distrust",
                fixture.getName(), domains.size(), fixture.getPrincipals().size(), fixture.getTrustEdges().size(),
                fixture.getEndorsements().size(), fixture.getDistrustEdges().size());
    }

    /** Keys of the principals loaded so far, for signing further records. */
    public Map<String, SigningKey> keys() {
        return Map.copyOf(keys);
    }

    public RecordSigner signerFor(String principalId) {
        SigningKey key = keys.get(principalId);
        if (key == null)
            throw new IllegalArgumentException("No key for principal '" + principalId + "'");
        return new RecordSigner(key, clock);
    }

    /** Flips the low bit of the first signature byte. */
    static Signature tamper(Signature signature) {
        byte[] raw = Base64.getDecoder().decode(signature.signature());
        raw[0] ^= 0x01;
        return signature.withSignature(Base64.getEncoder().encodeToString(raw));
    }

    /**
     * Parses an ISO instant or a clock-relative offset ({@code now},
     * {@code now-30d}, {@code now+6h}, {@code now-15m}).
     */
    Instant instant(String text) {
        if (text == null || text.isBlank())
            return null;
        if (!text.startsWith("now"))
            return Instant.parse(text);
        Instant now = clock.instant();
        if (text.length() == 3)
            return now;
        char sign = text.charAt(3);
        char unit = text.charAt(text.length() - 1);
        long amount = Long.parseLong(text.substring(4, text.length() - 1));
        Duration offset = switch (unit) {
            case 'd' -> Duration.ofDays(amount);
            case 'h' -> Duration.ofHours(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 's' -> Duration.ofSeconds(amount);
            default -> throw new IllegalArgumentException("Unknown time unit in '" + text + "'");
        };
        return switch (sign) {
            case '-' -> now.minus(offset);
            case '+' -> now.plus(offset);
            default -> throw new IllegalArgumentException("Malformed relative time '" + text + "'");
        };
    }
}
