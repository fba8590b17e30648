package com.ttp.trust.engine;

/**
 * Per-hop discount applied to a path of {@code k} hops.
 */
public enum DecayFunction {
    /** {@code d^k} */
    EXPONENTIAL {
        @Override
        public double apply(int hops, TrustEngineConfig config) {
            return Math.pow(config.getDecayFactor(), hops);
        }
    },
    /** {@code max(0, 1 - k * delta)} */
    LINEAR {
        @Override
        public double apply(int hops, TrustEngineConfig config) {
            return Math.max(0.0, 1.0 - hops * config.getLinearDecayDelta());
        }
    };

    public abstract double apply(int hops, TrustEngineConfig config);
}
