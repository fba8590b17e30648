package com.ttp.trust.domain;

import com.ttp.trust.api.Domain;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable forest of trust domains with parent pointers.
 *
 * <p>
 * Domains are stored in flat arrays and resolved through a map keyed by id,
 * so ancestor lookups are O(depth) array hops and never depend on the order
 * domains were added. Nothing is nested inside anything else.
 *
 * <p>
 * Data layout:
 * <ul>
 * <li>{@code domains}: domains in breadth-first order, roots first.</li>
 * <li>{@code parentIndex}: index of each domain's parent, or -1 for roots.</li>
 * <li>{@code depth}: 0 for roots.</li>
 * </ul>
 *
 * <p>
 * The reserved id {@link Domain#WILDCARD} is an implicit root above every
 * tree. It is always contained and is the last ancestor of every domain.
 */
@Log4j2
public final class DomainForest {
    private static final DomainForest EMPTY = builder().build();

    private final Domain[] domains;
    private final int[] parentIndex;
    private final int[] depth;
    private final Map<String, Integer> idToIndex;

    private DomainForest(Domain[] domains, int[] parentIndex, int[] depth, Map<String, Integer> idToIndex) {
        this.domains = domains;
        this.parentIndex = parentIndex;
        this.depth = depth;
        this.idToIndex = idToIndex;
    }

    public static DomainForest empty() {
        return EMPTY;
    }

    public int size() {
        return domains.length;
    }

    public boolean contains(String id) {
        return Domain.WILDCARD.equals(id) || idToIndex.containsKey(id);
    }

    public Optional<Domain> domain(String id) {
        Integer idx = idToIndex.get(id);
        return idx == null ? Optional.empty() : Optional.of(domains[idx]);
    }

    /** Parent id, {@code *} for a root, or null for the wildcard itself. */
    public String parentOf(String id) {
        if (Domain.WILDCARD.equals(id))
            return null;
        int idx = requireIndex(id);
        int p = parentIndex[idx];
        return p < 0 ? Domain.WILDCARD : domains[p].id();
    }

    /** Depth below the wildcard root: 1 for a root domain, 0 for {@code *}. */
    public int depthOf(String id) {
        if (Domain.WILDCARD.equals(id))
            return 0;
        return depth[requireIndex(id)] + 1;
    }

    /**
     * Ancestors of a domain, nearest first, ending with {@code *}.
     */
    public List<String> ancestors(String id) {
        if (Domain.WILDCARD.equals(id))
            return List.of();
        int idx = requireIndex(id);
        List<String> out = new ArrayList<>(depth[idx] + 1);
        for (int p = parentIndex[idx]; p >= 0; p = parentIndex[p])
            out.add(domains[p].id());
        out.add(Domain.WILDCARD);
        return out;
    }

    /**
     * Number of parent hops from {@code id} up to {@code ancestor}: 0 when
     * they are equal, -1 when {@code ancestor} is not above {@code id}.
     * Unknown ids are unrelated to everything except themselves.
     */
    public int distance(String ancestor, String id) {
        if (ancestor.equals(id))
            return 0;
        if (Domain.WILDCARD.equals(id))
            return -1;
        Integer idx = idToIndex.get(id);
        if (idx == null)
            return -1;
        if (Domain.WILDCARD.equals(ancestor))
            return depth[idx] + 1;
        int hops = 1;
        for (int p = parentIndex[idx]; p >= 0; p = parentIndex[p], hops++) {
            if (domains[p].id().equals(ancestor))
                return hops;
        }
        return -1;
    }

    public boolean isAncestorOrSelf(String ancestor, String id) {
        return distance(ancestor, id) >= 0;
    }

    /** Ids of all known domains, roots first. */
    public List<String> ids() {
        List<String> out = new ArrayList<>(domains.length);
        for (Domain d : domains)
            out.add(d.id());
        return out;
    }

    private int requireIndex(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new IllegalArgumentException("Unknown domain: " + id);
        return idx;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects domains and validates the hierarchy.
     */
    public static final class Builder {
        private final List<Domain> pending = new ArrayList<>();
        private final Map<String, Integer> idToPending = new HashMap<>();

        public Builder add(Domain domain) {
            if (Domain.WILDCARD.equals(domain.id()))
                throw new IllegalArgumentException("'*' is reserved and cannot be declared");
            if (idToPending.containsKey(domain.id()))
                throw new IllegalArgumentException("Duplicate domain id: " + domain.id());
            idToPending.put(domain.id(), pending.size());
            pending.add(domain);
            return this;
        }

        public Builder addAll(Collection<Domain> all) {
            for (Domain d : all)
                add(d);
            return this;
        }

        /**
         * Compiles the forest.
         * <p>
         * Runs Kahn's algorithm over parent-to-child links. Every node has at most
         * one parent, so any domain left unprocessed sits on or below a cycle.
         *
         * @throws IllegalArgumentException       if a parent id is not declared
         * @throws CyclicDomainHierarchyException if the parent chain loops
         */
        public DomainForest build() {
            int n = pending.size();
            int[] parentOf = new int[n];
            Map<Integer, List<Integer>> children = new HashMap<>();

            // 1. Resolve parent ids
            for (int i = 0; i < n; i++) {
                Domain d = pending.get(i);
                String parent = d.parent();
                if (parent == null || Domain.WILDCARD.equals(parent)) {
                    parentOf[i] = -1;
                    continue;
                }
                Integer p = idToPending.get(parent);
                if (p == null)
                    throw new IllegalArgumentException(
                            "Domain '" + d.id() + "' references unknown parent '" + parent + "'");
                parentOf[i] = p;
                children.computeIfAbsent(p, k -> new ArrayList<>()).add(i);
            }

            // 2. Roots seed the queue
            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (parentOf[i] < 0)
                    queue[tail++] = i;

            // 3. Breadth-first from the roots
            int[] newIndex = new int[n];
            Arrays.fill(newIndex, -1);
            int[] depthOf = new int[n];
            while (head < tail) {
                int curr = queue[head];
                newIndex[curr] = head++;
                for (int child : children.getOrDefault(curr, List.of())) {
                    depthOf[child] = depthOf[curr] + 1;
                    queue[tail++] = child;
                }
            }
            if (tail != n) {
                List<String> unresolved = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (newIndex[i] < 0)
                        unresolved.add(pending.get(i).id());
                throw new CyclicDomainHierarchyException(unresolved);
            }

            // 4. Flatten into arrays
            Domain[] ordered = new Domain[n];
            int[] parents = new int[n];
            int[] depths = new int[n];
            Map<String, Integer> index = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                int orig = queue[ti];
                ordered[ti] = pending.get(orig);
                parents[ti] = parentOf[orig] < 0 ? -1 : newIndex[parentOf[orig]];
                depths[ti] = depthOf[orig];
                index.put(ordered[ti].id(), ti);
            }
            if (n > 0)
                log.debug("Built domain forest with {} domains", n);
            return new DomainForest(ordered, parents, depths, Map.copyOf(index));
        }
    }
}
