package com.ttp.trust.crypto;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ttp.trust.api.DistrustEdge;
import com.ttp.trust.api.Endorsement;
import com.ttp.trust.api.SignedRecord;
import com.ttp.trust.api.TrustEdge;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic encoding of a signed record's payload.
 *
 * <p>
 * The same bytes must come out on the issuing side and the verifying side, so
 * the format is fixed here and used everywhere signatures are produced or
 * checked:
 * <ul>
 * <li>JSON, keys sorted alphabetically at every level, no whitespace.</li>
 * <li>The {@code signature} field is never part of the payload.</li>
 * <li>A {@code type} discriminator ({@code trust_edge}, {@code endorsement}
 * or {@code distrust_edge}) so a signature cannot be replayed across record
 * types.</li>
 * <li>Weights as plain decimals without trailing zeros: {@code 1},
 * {@code 0.9}, {@code 0.0001}.</li>
 * <li>Instants as UTC ISO-8601 with milliseconds:
 * {@code 2024-01-01T00:00:00.000Z}.</li>
 * <li>Absent optional fields are omitted, never written as null.</li>
 * </ul>
 */
public final class CanonicalEncoder {
    public static final String TYPE_TRUST_EDGE = "trust_edge";
    public static final String TYPE_ENDORSEMENT = "endorsement";
    public static final String TYPE_DISTRUST_EDGE = "distrust_edge";

    private static final DateTimeFormatter ISO_MILLIS = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

    private CanonicalEncoder() {
        // Utility class
    }

    /** Encodes any supported record type. */
    public static byte[] encode(SignedRecord record) {
        if (record instanceof TrustEdge edge)
            return encode(edge);
        if (record instanceof Endorsement endorsement)
            return encode(endorsement);
        if (record instanceof DistrustEdge distrust)
            return encode(distrust);
        throw new IllegalArgumentException("Unsupported record type: " + record.getClass().getName());
    }

    public static byte[] encode(TrustEdge edge) {
        Map<String, Object> payload = basePayload(edge, TYPE_TRUST_EDGE);
        payload.put("to", edge.to());
        payload.put("weight", formatWeight(edge.weight()));
        return toBytes(payload);
    }

    public static byte[] encode(Endorsement endorsement) {
        Map<String, Object> payload = basePayload(endorsement, TYPE_ENDORSEMENT);
        payload.put("subject", endorsement.subject());
        payload.put("weight", formatWeight(endorsement.weight()));
        return toBytes(payload);
    }

    /** Distrust payloads carry a {@code reason} and no weight. */
    public static byte[] encode(DistrustEdge distrust) {
        Map<String, Object> payload = basePayload(distrust, TYPE_DISTRUST_EDGE);
        payload.put("to", distrust.to());
        payload.put("reason", distrust.reason().wireName());
        return toBytes(payload);
    }

    /**
     * Canonical JSON text of an arbitrary map payload. Nested maps are sorted
     * too. Doubles are normalized the same way as record weights.
     */
    public static String canonicalJson(Map<String, ?> payload) {
        try {
            return MAPPER.writeValueAsString(normalize(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonicalize payload", e);
        }
    }

    /** Formats an instant the way it appears inside a payload. */
    public static String formatInstant(Instant instant) {
        return ISO_MILLIS.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    /** Formats a weight the way it appears inside a payload. */
    public static BigDecimal formatWeight(double weight) {
        if (Double.isNaN(weight) || Double.isInfinite(weight))
            throw new IllegalArgumentException("Weight is not a finite number: " + weight);
        BigDecimal d = BigDecimal.valueOf(weight).stripTrailingZeros();
        return d.signum() == 0 ? BigDecimal.ZERO : d;
    }

    private static Map<String, Object> basePayload(SignedRecord record, String type) {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("type", type);
        payload.put("from", record.from());
        payload.put("domain", record.domain());
        payload.put("issuedAt", formatInstant(record.issuedAt()));
        if (record.expiresAt() != null)
            payload.put("expiresAt", formatInstant(record.expiresAt()));
        return payload;
    }

    private static byte[] toBytes(Map<String, Object> payload) {
        try {
            return MAPPER.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to canonicalize payload", e);
        }
    }

    private static Object normalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                if (e.getValue() != null)
                    sorted.put(String.valueOf(e.getKey()), normalize(e.getValue()));
            }
            return sorted;
        }
        if (value instanceof Iterable<?> items) {
            List<Object> list = new ArrayList<>();
            for (Object item : items)
                list.add(normalize(item));
            return list;
        }
        if (value instanceof Double || value instanceof Float)
            return formatWeight(((Number) value).doubleValue());
        if (value instanceof Instant instant)
            return formatInstant(instant);
        return value;
    }
}
