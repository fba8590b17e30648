package com.ttp.trust.api;

/** Structural warning raised by a {@link SybilSignal}. */
public enum SybilFlag {
    NEW_ACCOUNT,
    LOW_PATH_DIVERSITY,
    NO_INBOUND_TRUST,
    HIGH_RECIPROCITY,
    RAPID_EDGE_CREATION,
    HIGH_CLUSTER_COEFFICIENT
}
