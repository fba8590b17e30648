package com.ttp.trust.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ttp.trust.api.PortUnavailableException;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;
import com.ttp.trust.engine.TrustQueryEngine;
import com.ttp.trust.util.ExclusionCountingListener;
import com.ttp.trust.util.LatencyTrackingListener;

import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Thin HTTP front for a {@link TrustQueryEngine}.
 *
 * <ul>
 * <li>{@code POST /api/trust/query}: runs one query. 400 for an invalid
 * query, 503 (retryable) when the graph store is down.</li>
 * <li>{@code GET /api/trust/stats}: exclusion counters, latency and cache
 * figures.</li>
 * </ul>
 */
public class TrustQueryServer {
    private static final Logger log = LogManager.getLogger(TrustQueryServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TrustQueryEngine engine;
    private final PrincipalResolver resolver;
    private ExclusionCountingListener exclusions;
    private LatencyTrackingListener latency;
    private Javalin app;

    public TrustQueryServer(TrustQueryEngine engine, PrincipalResolver resolver) {
        this.engine = engine;
        this.resolver = resolver;
    }

    /** Sources for {@code /api/trust/stats}; either may be null. */
    public void setStatsSources(ExclusionCountingListener exclusions, LatencyTrackingListener latency) {
        this.exclusions = exclusions;
        this.latency = latency;
    }

    /**
     * Starts the server.
     *
     * @param port port to listen on, 0 for an ephemeral one
     */
    public void start(int port) {
        log.info("Starting trust query server on port {}", port);
        app = Javalin.create();

        app.post("/api/trust/query", this::handleQuery);
        app.get("/api/trust/stats", ctx -> json(ctx, stats()));

        app.exception(PortUnavailableException.class, (e, ctx) -> {
            log.warn("Query failed, graph store unavailable: {}", e.getMessage());
            ctx.status(503);
            json(ctx, error(e.getMessage(), e.isRetryable()));
        });
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            ctx.status(400);
            json(ctx, error(e.getMessage(), false));
        });
        app.exception(JsonProcessingException.class, (e, ctx) -> {
            ctx.status(400);
            json(ctx, error("Malformed request body: " + e.getOriginalMessage(), false));
        });
        app.start(port);
    }

    /** Actual bound port; useful after {@code start(0)}. */
    public int port() {
        return app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    private void handleQuery(Context ctx) throws JsonProcessingException {
        QueryRequest request = MAPPER.readValue(ctx.body(), QueryRequest.class);
        String source = request.getSource();
        if (source == null || source.isBlank())
            source = resolver.resolve(ctx)
                    .orElseThrow(() -> new IllegalArgumentException("source is required"));
        TrustQuery query = request.toQuery(source);
        TrustResult result = engine.query(query);
        json(ctx, QueryResponse.from(result));
    }

    private Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (exclusions != null)
            out.put("exclusions", exclusions.snapshot());
        if (latency != null) {
            Map<String, Object> l = new LinkedHashMap<>();
            l.put("queries", latency.totalQueries());
            l.put("cacheHits", latency.cacheHits());
            l.put("truncated", latency.truncatedResults());
            l.put("errors", latency.errors());
            l.put("avgMicros", latency.avgLatencyMicros());
            l.put("minMicros", latency.minLatencyNanos() / 1000.0);
            l.put("maxMicros", latency.maxLatencyNanos() / 1000.0);
            out.put("latency", l);
        }
        Map<String, Object> cache = new LinkedHashMap<>();
        cache.put("size", engine.cache().size());
        cache.put("hits", engine.cache().hits());
        cache.put("misses", engine.cache().misses());
        cache.put("evictions", engine.cache().evictions());
        out.put("cache", cache);
        return out;
    }

    private static Map<String, Object> error(String message, boolean retryable) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", message);
        out.put("retryable", retryable);
        return out;
    }

    private static void json(Context ctx, Object body) {
        try {
            ctx.contentType("application/json").result(MAPPER.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
