package com.ttp.trust.web;

import io.javalin.http.Context;

import java.util.Optional;

final class HeaderPrincipalResolver implements PrincipalResolver {
    static final String DEFAULT_HEADER = "X-Principal-Id";

    private final String header;

    HeaderPrincipalResolver(String header) {
        this.header = header;
    }

    @Override
    public Optional<String> resolve(Context ctx) {
        String value = ctx.header(header);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
