package com.ttp.trust;

import com.ttp.trust.api.GraphAccessPort;
import com.ttp.trust.api.TrustComputationListener;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;
import com.ttp.trust.api.TrustTarget;
import com.ttp.trust.engine.TrustEngineConfig;
import com.ttp.trust.engine.TrustQueryEngine;
import com.ttp.trust.store.GraphFixtureLoader;
import com.ttp.trust.store.InMemoryGraphStore;
import com.ttp.trust.util.ExclusionCountingListener;
import com.ttp.trust.util.LatencyTrackingListener;
import com.ttp.trust.util.ResultExplain;
import com.ttp.trust.web.PrincipalResolver;
import com.ttp.trust.web.TrustQueryServer;
import com.ttp.trust.wiring.GraphChangePublisher;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Wires a {@link TrustQueryEngine} to a graph port.
 * <p>
 * This class handles:
 * <ul>
 * <li>Building the engine from a {@link TrustEngineConfig}</li>
 * <li>Routing the port's change signals through a
 * {@link GraphChangePublisher} into cache invalidation</li>
 * <li>Optional latency tracking, exclusion counting and the HTTP query
 * endpoint</li>
 * </ul>
 */
public class TrustGraph implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(TrustGraph.class);

    private final GraphAccessPort port;
    private final TrustQueryEngine engine;
    private final GraphChangePublisher publisher;

    private LatencyTrackingListener latency;
    private ExclusionCountingListener exclusions;
    private TrustQueryServer server;

    /** Uses {@code trust-engine.json} from the classpath, or defaults. */
    public TrustGraph(GraphAccessPort port) {
        this(port, TrustEngineConfig.load());
    }

    public TrustGraph(GraphAccessPort port, TrustEngineConfig config) {
        this(port, new TrustQueryEngine(port, config));
    }

    public TrustGraph(GraphAccessPort port, TrustQueryEngine engine) {
        this.port = port;
        this.engine = engine;
        this.publisher = new GraphChangePublisher(engine::invalidate);
        port.addChangeListener(publisher);
    }

    /** Loads a fixture resource into a fresh in-memory store. */
    public static TrustGraph fromFixture(String resource) {
        InMemoryGraphStore store = new GraphFixtureLoader().loadResource(resource);
        return new TrustGraph(store);
    }

    public TrustResult query(TrustQuery query) {
        return engine.query(query);
    }

    public TrustResult trust(String source, String targetPrincipal, String domain) {
        return engine.query(TrustQuery.of(source, TrustTarget.principal(targetPrincipal), domain));
    }

    public TrustResult trustInSubject(String source, String subject, String domain) {
        return engine.query(TrustQuery.of(source, TrustTarget.subject(subject), domain));
    }

    public String explain(TrustQuery query) {
        return ResultExplain.explain(query, engine.query(query));
    }

    public void addListener(TrustComputationListener listener) {
        engine.addListener(listener);
    }

    /**
     * Enables query latency tracking.
     * If already enabled, returns the existing listener.
     */
    public synchronized LatencyTrackingListener enableLatencyTracking() {
        if (latency == null) {
            latency = new LatencyTrackingListener();
            engine.addListener(latency);
        }
        return latency;
    }

    /** Enables per-reason counting of excluded records. */
    public synchronized ExclusionCountingListener enableExclusionCounting() {
        if (exclusions == null) {
            exclusions = new ExclusionCountingListener();
            engine.addListener(exclusions);
        }
        return exclusions;
    }

    /**
     * Starts the HTTP query endpoint. Principals without an explicit source
     * are taken from the {@code X-Principal-Id} header.
     */
    public synchronized TrustQueryServer startQueryServer(int port) {
        if (server != null)
            return server;
        server = new TrustQueryServer(engine, PrincipalResolver.header());
        server.setStatsSources(enableExclusionCounting(), enableLatencyTracking());
        server.start(port);
        return server;
    }

    /**
     * Waits until graph changes published so far have reached the cache.
     *
     * @return false on timeout
     */
    public boolean flushChanges(long timeoutMillis) throws InterruptedException {
        return publisher.flush(timeoutMillis);
    }

    public TrustQueryEngine getEngine() {
        return engine;
    }

    @Override
    public void close() {
        if (server != null)
            server.stop();
        port.removeChangeListener(publisher);
        publisher.close();
        engine.close();
        log.info("Trust graph closed");
    }
}
