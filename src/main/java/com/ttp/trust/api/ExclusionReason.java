package com.ttp.trust.api;

/**
 * Why a signed record was left out of trust computation. Exclusions are
 * terminal for the record but never fail the query.
 */
public enum ExclusionReason {
    INVALID_SIGNATURE,
    UNKNOWN_SIGNER,
    EXPIRED,
    NOT_YET_VALID,
    WEIGHT_OUT_OF_RANGE,
    DOMAIN_MISMATCH
}
