package com.ttp.trust.web;

import io.javalin.http.Context;

import java.util.Optional;

/**
 * Maps an HTTP request to the id of the calling principal. Authentication
 * lives in front of this seam; the engine only ever sees resolved ids.
 */
@FunctionalInterface
public interface PrincipalResolver {
    Optional<String> resolve(Context ctx);

    /** Trusts the {@code X-Principal-Id} header set by an upstream gateway. */
    static PrincipalResolver header() {
        return header(HeaderPrincipalResolver.DEFAULT_HEADER);
    }

    static PrincipalResolver header(String name) {
        return new HeaderPrincipalResolver(name);
    }
}
