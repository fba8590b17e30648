package com.ttp.trust.api;

/** Kind of entity that can receive endorsements. */
public enum SubjectType {
    BUSINESS, INDIVIDUAL, PRODUCT, SERVICE
}
