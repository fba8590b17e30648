package com.ttp.trust.engine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import lombok.Data;

/**
 * Policy constants of the trust computation, bound from JSON.
 *
 * <p>
 * Every field has a default, so a partial JSON document (or none) is enough.
 * Call {@link #validate()} after editing values by hand. The loaders
 * validate on their own. Components take a {@link #copy()} when they are
 * built, so later edits to a caller's instance have no effect on them.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TrustEngineConfig {
    /** Classpath resource read by {@link #load()}. */
    public static final String DEFAULT_RESOURCE = "/trust-engine.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Decay & aggregation
    private DecayFunction decayFunction = DecayFunction.EXPONENTIAL;
    private double decayFactor = 0.7;
    private double linearDecayDelta = 0.25;
    private AggregationStrategy aggregation = AggregationStrategy.DIMINISHING_RETURNS;
    private double domainInheritanceDiscount = 0.9;
    private double minPathConfidence = 0.001;
    private double endorsementHalfLifeDays = 0;

    // Enumeration bounds
    private int defaultMaxDepth = 4;
    private int maxDepthLimit = 6;
    private int maxFanOut = 64;
    private int maxNodesVisited = 10_000;
    private long queryTimeoutMillis = 2_000;
    private int parallelism = 4;
    private double truncationConfidencePenalty = 0.5;

    // Result shape
    private int maxExplainedPaths = 10;

    // Cache
    private int cacheMaxEntries = 10_000;
    private long cacheTtlSeconds = 3_600;

    private SybilConfig sybil = new SybilConfig();

    /** Thresholds of the sybil resistance scorer. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SybilConfig {
        private double redundancyPenalty = 0.5;
        private double riskWeight = 0.5;
        private int newAccountDays = 30;
        private int rapidEdgeWindowDays = 7;
        private int rapidEdgeCount = 20;
        private double highReciprocity = 0.7;
        private double highClusterCoefficient = 0.8;
        private int diversitySaturation = 10;
    }

    /** Loads {@link #DEFAULT_RESOURCE}, falling back to defaults if absent. */
    public static TrustEngineConfig load() {
        try (InputStream in = TrustEngineConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null)
                return new TrustEngineConfig().validate();
            return MAPPER.readValue(in, TrustEngineConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static TrustEngineConfig fromFile(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    public static TrustEngineConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, TrustEngineConfig.class).validate();
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid trust engine configuration: " + e.getMessage(), e);
        }
    }

    /** Deep copy through the JSON form. */
    public TrustEngineConfig copy() {
        try {
            return MAPPER.readValue(MAPPER.writeValueAsBytes(this), TrustEngineConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to copy trust engine configuration", e);
        }
    }

    /**
     * Checks ranges and returns {@code this}.
     *
     * @throws IllegalArgumentException naming the first offending field
     */
    public TrustEngineConfig validate() {
        require(decayFunction != null, "decayFunction is required");
        require(aggregation != null, "aggregation is required");
        require(decayFactor > 0 && decayFactor < 1, "decayFactor must be in (0,1)");
        require(linearDecayDelta > 0 && linearDecayDelta <= 1, "linearDecayDelta must be in (0,1]");
        require(domainInheritanceDiscount >= 0 && domainInheritanceDiscount <= 1,
                "domainInheritanceDiscount must be in [0,1]");
        require(minPathConfidence >= 0 && minPathConfidence < 1, "minPathConfidence must be in [0,1)");
        require(endorsementHalfLifeDays >= 0, "endorsementHalfLifeDays must be >= 0");
        require(defaultMaxDepth >= 0, "defaultMaxDepth must be >= 0");
        require(maxDepthLimit >= defaultMaxDepth, "maxDepthLimit must be >= defaultMaxDepth");
        require(maxFanOut > 0, "maxFanOut must be > 0");
        require(maxNodesVisited > 0, "maxNodesVisited must be > 0");
        require(queryTimeoutMillis > 0, "queryTimeoutMillis must be > 0");
        require(parallelism > 0, "parallelism must be > 0");
        require(truncationConfidencePenalty >= 0 && truncationConfidencePenalty <= 1,
                "truncationConfidencePenalty must be in [0,1]");
        require(maxExplainedPaths > 0, "maxExplainedPaths must be > 0");
        require(cacheMaxEntries >= 0, "cacheMaxEntries must be >= 0");
        require(cacheTtlSeconds > 0, "cacheTtlSeconds must be > 0");
        require(sybil != null, "sybil section is required");
        require(sybil.redundancyPenalty >= 0 && sybil.redundancyPenalty < 1,
                "sybil.redundancyPenalty must be in [0,1)");
        require(sybil.riskWeight >= 0 && sybil.riskWeight <= 1, "sybil.riskWeight must be in [0,1]");
        require(sybil.newAccountDays > 0, "sybil.newAccountDays must be > 0");
        require(sybil.rapidEdgeWindowDays > 0, "sybil.rapidEdgeWindowDays must be > 0");
        require(sybil.rapidEdgeCount > 0, "sybil.rapidEdgeCount must be > 0");
        require(sybil.highReciprocity > 0 && sybil.highReciprocity <= 1, "sybil.highReciprocity must be in (0,1]");
        require(sybil.highClusterCoefficient > 0 && sybil.highClusterCoefficient <= 1,
                "sybil.highClusterCoefficient must be in (0,1]");
        require(sybil.diversitySaturation > 0, "sybil.diversitySaturation must be > 0");
        return this;
    }

    private static void require(boolean ok, String message) {
        if (!ok)
            throw new IllegalArgumentException(message);
    }
}
