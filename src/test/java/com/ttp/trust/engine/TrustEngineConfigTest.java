package com.ttp.trust.engine;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;

import static org.junit.Assert.*;

public class TrustEngineConfigTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testDefaults() {
        TrustEngineConfig config = new TrustEngineConfig().validate();
        assertEquals(DecayFunction.EXPONENTIAL, config.getDecayFunction());
        assertEquals(0.7, config.getDecayFactor(), 0.0);
        assertEquals(AggregationStrategy.DIMINISHING_RETURNS, config.getAggregation());
        assertEquals(4, config.getDefaultMaxDepth());
        assertEquals(6, config.getMaxDepthLimit());
        assertEquals(0.5, config.getSybil().getRedundancyPenalty(), 0.0);
    }

    @Test
    public void testBundledResourceMatchesDefaults() {
        assertEquals(new TrustEngineConfig(), TrustEngineConfig.load());
    }

    @Test
    public void testPartialJsonKeepsDefaults() {
        TrustEngineConfig config = TrustEngineConfig.fromJson(
                "{\"decayFactor\":0.9,\"aggregation\":\"MAXIMUM\",\"sybil\":{\"riskWeight\":0.2}}");
        assertEquals(0.9, config.getDecayFactor(), 0.0);
        assertEquals(AggregationStrategy.MAXIMUM, config.getAggregation());
        assertEquals(0.2, config.getSybil().getRiskWeight(), 0.0);
        assertEquals(0.5, config.getSybil().getRedundancyPenalty(), 0.0);
        assertEquals(0.9, config.getDomainInheritanceDiscount(), 0.0);
    }

    @Test
    public void testFromFile() throws Exception {
        File f = tmp.newFile("engine.json");
        Files.writeString(f.toPath(), "{\"maxFanOut\":8,\"decayFunction\":\"LINEAR\"}");
        TrustEngineConfig config = TrustEngineConfig.fromFile(f.toPath());
        assertEquals(8, config.getMaxFanOut());
        assertEquals(DecayFunction.LINEAR, config.getDecayFunction());
    }

    @Test
    public void testValidationNamesField() {
        assertInvalid("{\"decayFactor\":1.0}", "decayFactor");
        assertInvalid("{\"defaultMaxDepth\":8}", "maxDepthLimit");
        assertInvalid("{\"maxFanOut\":0}", "maxFanOut");
        assertInvalid("{\"sybil\":{\"redundancyPenalty\":1.0}}", "sybil.redundancyPenalty");
        assertInvalid("{\"cacheTtlSeconds\":0}", "cacheTtlSeconds");
    }

    @Test
    public void testMalformedJsonRejected() {
        assertInvalid("{\"decayFactor\":", "Invalid trust engine configuration");
        assertInvalid("{\"decayFunction\":\"CUBIC\"}", "Invalid trust engine configuration");
    }

    private static void assertInvalid(String json, String expectedFragment) {
        try {
            TrustEngineConfig.fromJson(json);
            fail("expected rejection of " + json);
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(expectedFragment));
        }
    }
}
