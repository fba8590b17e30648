package com.ttp.trust.engine;

import com.lmax.disruptor.util.DaemonThreadFactory;
import com.ttp.trust.api.GraphAccessPort;
import com.ttp.trust.api.GraphChange;
import com.ttp.trust.api.GraphChangeListener;
import com.ttp.trust.api.GraphSnapshot;
import com.ttp.trust.api.PathExplanation;
import com.ttp.trust.api.PortUnavailableException;
import com.ttp.trust.api.QueryStats;
import com.ttp.trust.api.Truncation;
import com.ttp.trust.api.TrustComputationListener;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;
import com.ttp.trust.crypto.SignatureVerifier;
import com.ttp.trust.domain.DomainForest;
import com.ttp.trust.util.CompositeTrustListener;
import com.ttp.trust.util.ErrorRateLimiter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Answers {@link TrustQuery}s against a {@link GraphAccessPort}.
 *
 * <p>
 * <b>Per query:</b>
 * <ol>
 * <li>Resolve the effective depth (requested or default, clamped to
 * {@code maxDepthLimit}).</li>
 * <li>Serve from the {@link ResultCache} or compute under one snapshot:
 * gate, enumerate, rank, discount, aggregate, score confidence.</li>
 * <li>Apply the caller's {@code minConfidence} filter.</li>
 * </ol>
 *
 * <p>
 * The engine never writes to the graph. Register it (or a
 * {@code GraphChangePublisher} in front of it) as a change listener on the
 * port to keep the cache honest.
 */
public final class TrustQueryEngine implements GraphChangeListener, AutoCloseable {
    private static final Logger log = LogManager.getLogger(TrustQueryEngine.class);

    private final GraphAccessPort port;
    private final TrustEngineConfig config;
    private final SignatureVerifier verifier;
    private final Clock clock;
    private final CompositeTrustListener listeners = new CompositeTrustListener();
    private final ErrorRateLimiter portErrors = new ErrorRateLimiter(log, 1000);

    private final ExecutorService executor;
    private final PathEnumerator enumerator;
    private final DecayAggregator aggregator;
    private final SybilScorer sybilScorer;
    private final ResultCache cache;

    private volatile DomainForest lastForest = DomainForest.empty();

    public TrustQueryEngine(GraphAccessPort port, TrustEngineConfig config) {
        this(port, config, new SignatureVerifier(), Clock.systemUTC());
    }

    public TrustQueryEngine(GraphAccessPort port, TrustEngineConfig config, SignatureVerifier verifier, Clock clock) {
        this.port = port;
        this.config = config.copy().validate();
        this.verifier = verifier;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(this.config.getParallelism(), DaemonThreadFactory.INSTANCE);
        this.enumerator = new PathEnumerator(this.config, executor);
        this.aggregator = new DecayAggregator(this.config);
        this.sybilScorer = new SybilScorer(this.config.getSybil());
        this.cache = new ResultCache(this.config.getCacheMaxEntries(), this.config.getCacheTtlSeconds());
        log.info("Trust engine ready: decay={} factor={} aggregation={} depth={}/{} parallelism={}",
                this.config.getDecayFunction(), this.config.getDecayFactor(), this.config.getAggregation(),
                this.config.getDefaultMaxDepth(), this.config.getMaxDepthLimit(), this.config.getParallelism());
    }

    public void addListener(TrustComputationListener listener) {
        listeners.add(listener);
    }

    public void removeListener(TrustComputationListener listener) {
        listeners.remove(listener);
    }

    /** A copy of the validated configuration in effect. */
    public TrustEngineConfig config() {
        return config.copy();
    }

    public ResultCache cache() {
        return cache;
    }

    /**
     * Computes (or serves from cache) the trust from the query's source to its
     * target.
     *
     * @throws IllegalArgumentException  for an unknown domain
     * @throws PortUnavailableException if the graph store cannot be read
     */
    public TrustResult query(TrustQuery query) {
        listeners.onQueryStart(query);
        long start = System.nanoTime();
        try {
            int requested = query.maxDepth() != null ? query.maxDepth() : config.getDefaultMaxDepth();
            int effective = Math.min(requested, config.getMaxDepthLimit());
            boolean clamped = requested > effective;

            TrustResult result = cache.get(ResultCache.Key.of(query, effective),
                    () -> compute(query, effective, clamped),
                    () -> listeners.onCacheHit(query));
            result = result.filterByConfidence(query.minConfidence());
            listeners.onQueryEnd(query, result, System.nanoTime() - start);
            return result;
        } catch (PortUnavailableException e) {
            portErrors.log("Graph store unavailable for query from " + query.source(), e);
            listeners.onQueryError(query, e);
            throw e;
        } catch (RuntimeException e) {
            listeners.onQueryError(query, e);
            throw e;
        }
    }

    /** Drops cached results the change may have made stale. */
    public void invalidate(GraphChange change) {
        int removed = cache.invalidate(change, lastForest);
        if (removed > 0)
            log.debug("Invalidated {} cached results after {}", removed, change);
    }

    @Override
    public void onGraphChange(GraphChange change) {
        invalidate(change);
    }

    private TrustResult compute(TrustQuery query, int maxDepth, boolean clamped) {
        Instant now = clock.instant();
        try (GraphSnapshot snapshot = port.openSnapshot()) {
            DomainForest forest = snapshot.domains();
            lastForest = forest;
            if (!forest.contains(query.domain()))
                throw new IllegalArgumentException("Unknown domain: " + query.domain());

            if (!query.target().isSubject() && query.target().id().equals(query.source()))
                return selfTrust(query, now);

            EdgeGate gate = new EdgeGate(snapshot, verifier, query.domain(), config.getDomainInheritanceDiscount(),
                    now, listeners);
            WorkBudget budget = new WorkBudget(config.getMaxNodesVisited(), config.getQueryTimeoutMillis());
            PathEnumerator.Enumeration found = enumerator.enumerate(gate, query.source(), query.target(), maxDepth,
                    budget);

            Truncation truncation = found.truncation();
            if (!truncation.isPartial() && clamped)
                truncation = Truncation.DEPTH_LIMIT;
            if (truncation.isPartial())
                log.debug("Query {} -> {} truncated: {}", query.source(), query.target().id(), truncation);

            QueryStats stats = new QueryStats(found.nodesVisited(), gate.edgesExamined(), found.paths().size(),
                    gate.exclusions());
            double penalty = truncation.isPartial() ? config.getTruncationConfidencePenalty() : 1.0;

            if (found.paths().isEmpty()) {
                return truncation.isPartial()
                        ? new TrustResult(0.0, penalty, List.of(), now, truncation, false, stats)
                        : TrustResult.noPath(now, stats);
            }

            List<ScoredPath> ranked = aggregator.rank(found.paths(), now);
            double[] redundancy = sybilScorer.redundancyFactors(ranked);
            double score = aggregator.aggregate(ranked, redundancy);
            double confidence = sybilScorer.confidence(ranked,
                    new SybilSignalProvider(gate, config.getSybil())) * penalty;

            int shown = Math.min(ranked.size(), config.getMaxExplainedPaths());
            List<PathExplanation> explanation = new ArrayList<>(shown);
            for (int i = 0; i < shown; i++) {
                ScoredPath s = ranked.get(i);
                explanation.add(new PathExplanation(s.path().principals(), s.path().hops(), s.rawConfidence(),
                        1.0 - redundancy[i]));
            }
            return new TrustResult(score, confidence, explanation, now, truncation, false, stats);
        }
    }

    private static TrustResult selfTrust(TrustQuery query, Instant now) {
        PathExplanation self = new PathExplanation(List.of(query.source()), 0, 1.0, 0.0);
        return new TrustResult(1.0, 1.0, List.of(self), now, Truncation.NONE, false, QueryStats.EMPTY);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS))
                log.warn("Enumeration workers did not stop within 5s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        cache.clear();
    }
}
