package com.ttp.trust.engine;

import com.ttp.trust.api.Truncation;
import com.ttp.trust.api.TrustEdge;
import com.ttp.trust.api.TrustTarget;
import com.ttp.trust.engine.EdgeGate.WeightedEdge;
import com.ttp.trust.engine.EdgeGate.WeightedEndorsement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import lombok.extern.log4j.Log4j2;

/**
 * Bounded depth-first enumeration of trust paths.
 *
 * <p>
 * A branch ends at the target principal (or at a principal holding an
 * admitted endorsement of the target subject), at {@code maxDepth} trust
 * edges, or when the next principal is already on the path. Principals the
 * source has distrusted in the query domain are never entered. Per principal
 * at most {@code maxFanOut} edges are followed, strongest first. Prefixes
 * that can no longer reach {@code minPathConfidence} are pruned.
 *
 * <p>
 * First-hop branches run on the shared executor. All branches share one
 * {@link WorkBudget}; paths found before a cancellation are kept.
 */
@Log4j2
public final class PathEnumerator {

    /** Paths found by one enumeration plus how it ended. */
    public record Enumeration(List<CandidatePath> paths, Truncation truncation, int nodesVisited) {
        public Enumeration {
            paths = List.copyOf(paths);
        }
    }

    private final TrustEngineConfig config;
    private final ExecutorService executor;

    public PathEnumerator(TrustEngineConfig config, ExecutorService executor) {
        this.config = config;
        this.executor = executor;
    }

    public Enumeration enumerate(EdgeGate gate, String source, TrustTarget target, int maxDepth,
            WorkBudget budget) {
        Search root = new Search(gate, source, target, maxDepth, budget);
        List<CandidatePath> found = new ArrayList<>();
        List<WeightedEdge> branches = root.expandRoot(found);

        if (branches.size() <= 1 || config.getParallelism() <= 1) {
            for (WeightedEdge first : branches)
                root.descend(first, found);
        } else {
            runParallel(root, branches, found);
        }
        return new Enumeration(found, budget.truncation(), budget.visited());
    }

    private void runParallel(Search root, List<WeightedEdge> branches, List<CandidatePath> found) {
        List<List<CandidatePath>> partial = new ArrayList<>(branches.size());
        List<Future<?>> futures = new ArrayList<>(branches.size());
        for (WeightedEdge first : branches) {
            List<CandidatePath> sink = Collections.synchronizedList(new ArrayList<>());
            partial.add(sink);
            futures.add(executor.submit(() -> root.descend(first, sink)));
        }

        RuntimeException failure = null;
        try {
            for (Future<?> f : futures) {
                try {
                    f.get(root.budget.remainingNanos(), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    root.budget.cancel(Truncation.DEADLINE);
                    break;
                } catch (ExecutionException e) {
                    root.budget.cancel(Truncation.DEADLINE);
                    Throwable cause = e.getCause();
                    if (cause instanceof Error err)
                        throw err;
                    failure = cause instanceof RuntimeException re ? re
                            : new IllegalStateException("Enumeration branch failed", cause);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            root.budget.cancel(Truncation.DEADLINE);
        } finally {
            for (Future<?> f : futures)
                f.cancel(true);
        }
        if (failure != null)
            throw failure;

        for (List<CandidatePath> sink : partial) {
            synchronized (sink) {
                found.addAll(sink);
            }
        }
    }

    /** Immutable per-enumeration state shared by all branches. */
    private final class Search {
        final EdgeGate gate;
        final String source;
        final TrustTarget target;
        final int maxDepth;
        final WorkBudget budget;
        final int maxFanOut = config.getMaxFanOut();
        final double minPathConfidence = config.getMinPathConfidence();

        Search(EdgeGate gate, String source, TrustTarget target, int maxDepth, WorkBudget budget) {
            this.gate = gate;
            this.source = source;
            this.target = target;
            this.maxDepth = maxDepth;
            this.budget = budget;
        }

        /** Visits the source and returns the first hops still worth descending into. */
        List<WeightedEdge> expandRoot(List<CandidatePath> found) {
            if (!budget.tryVisit())
                return List.of();
            Frame frame = new Frame(source);
            if (emitEndorsement(frame, found) || maxDepth == 0)
                return List.of();
            List<WeightedEdge> next = new ArrayList<>();
            for (WeightedEdge e : followable(source)) {
                if (e.edge().to().equals(source))
                    continue;
                if (reachesTarget(e)) {
                    emitPrincipal(frame, e, found);
                } else if (worthExpanding(frame.product * e.weight(), 1)) {
                    next.add(e);
                }
            }
            return next;
        }

        void descend(WeightedEdge first, List<CandidatePath> sink) {
            Frame frame = new Frame(source);
            frame.push(first);
            dfs(frame, sink);
        }

        private void dfs(Frame frame, List<CandidatePath> sink) {
            if (!budget.tryVisit())
                return;
            String node = frame.last();
            if (emitEndorsement(frame, sink))
                return;
            int depth = frame.depth();
            if (depth >= maxDepth)
                return;
            for (WeightedEdge e : followable(node)) {
                if (budget.isCancelled())
                    return;
                String next = e.edge().to();
                if (frame.onPath.contains(next))
                    continue;
                if (reachesTarget(e)) {
                    emitPrincipal(frame, e, sink);
                    continue;
                }
                if (!worthExpanding(frame.product * e.weight(), depth + 1))
                    continue;
                frame.push(e);
                dfs(frame, sink);
                frame.pop();
            }
        }

        private List<WeightedEdge> followable(String principal) {
            List<WeightedEdge> edges = withoutDistrusted(gate.outgoing(principal));
            if (edges.size() <= maxFanOut)
                return edges;
            budget.markFanOutLimited();
            log.debug("Fan-out of {} capped at {} of {} edges", principal, maxFanOut, edges.size());
            return edges.subList(0, maxFanOut);
        }

        private List<WeightedEdge> withoutDistrusted(List<WeightedEdge> edges) {
            List<WeightedEdge> kept = null;
            for (int i = 0; i < edges.size(); i++) {
                WeightedEdge e = edges.get(i);
                if (gate.distrusts(source, e.edge().to())) {
                    if (kept == null)
                        kept = new ArrayList<>(edges.subList(0, i));
                } else if (kept != null) {
                    kept.add(e);
                }
            }
            return kept == null ? edges : kept;
        }

        private boolean reachesTarget(WeightedEdge e) {
            return !target.isSubject() && e.edge().to().equals(target.id());
        }

        /**
         * A prefix of {@code depth} edges needs at least one more hop, so its
         * best possible completion decays by {@code depth + 1}.
         */
        private boolean worthExpanding(double product, int depth) {
            return product * config.getDecayFunction().apply(depth + 1, config) >= minPathConfidence;
        }

        private boolean completes(double product, int hops) {
            return product > 0.0 && product * config.getDecayFunction().apply(hops, config) >= minPathConfidence;
        }

        private void emitPrincipal(Frame frame, WeightedEdge last, List<CandidatePath> sink) {
            double product = frame.product * last.weight();
            if (!completes(product, frame.depth() + 1))
                return;
            frame.push(last);
            sink.add(new CandidatePath(source, frame.edges(), frame.weights(), null, 0.0));
            frame.pop();
        }

        /**
         * Records the path ending in the current principal's endorsement of
         * the target subject.
         *
         * @return true when the principal holds an admitted endorsement, which
         *         ends the branch whether or not the path was strong enough
         */
        private boolean emitEndorsement(Frame frame, List<CandidatePath> sink) {
            if (!target.isSubject())
                return false;
            Optional<WeightedEndorsement> endorsement = gate.endorsement(frame.last(), target.id());
            if (endorsement.isEmpty())
                return false;
            WeightedEndorsement we = endorsement.get();
            if (completes(frame.product * we.weight(), frame.depth() + 1))
                sink.add(new CandidatePath(source, frame.edges(), frame.weights(), we.endorsement(), we.weight()));
            return true;
        }
    }

    /** Mutable DFS stack, owned by one branch thread. */
    private static final class Frame {
        final List<WeightedEdge> stack = new ArrayList<>();
        final Set<String> onPath = new HashSet<>();
        final String source;
        double product = 1.0;

        Frame(String source) {
            this.source = source;
            onPath.add(source);
        }

        int depth() {
            return stack.size();
        }

        String last() {
            return stack.isEmpty() ? source : stack.get(stack.size() - 1).edge().to();
        }

        void push(WeightedEdge e) {
            stack.add(e);
            onPath.add(e.edge().to());
            product *= e.weight();
        }

        void pop() {
            WeightedEdge e = stack.remove(stack.size() - 1);
            onPath.remove(e.edge().to());
            product = recompute();
        }

        private double recompute() {
            double p = 1.0;
            for (WeightedEdge e : stack)
                p *= e.weight();
            return p;
        }

        List<TrustEdge> edges() {
            List<TrustEdge> out = new ArrayList<>(stack.size());
            for (WeightedEdge e : stack)
                out.add(e.edge());
            return out;
        }

        double[] weights() {
            double[] out = new double[stack.size()];
            for (int i = 0; i < out.length; i++)
                out[i] = stack.get(i).weight();
            return out;
        }
    }
}
