package com.ttp.trust.api;

/** Kind of entity that can hold and delegate trust. */
public enum PrincipalType {
    USER, ORGANIZATION, AGENT
}
