package com.ttp.trust.util;

import com.ttp.trust.api.ExclusionReason;
import com.ttp.trust.api.PathExplanation;
import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Human-readable renderings of a {@link TrustResult}.
 *
 * <p>
 * <b>Usage:</b> debugging sessions and logs. Do <b>not</b> use on the hot
 * path (allocates strings).
 */
public final class ResultExplain {
    private ResultExplain() {
    }

    /**
     * Multi-line summary: score, confidence, truncation, every explained path
     * and the exclusion counts.
     */
    public static String explain(TrustQuery query, TrustResult result) {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Trust ").append(query.source()).append(" -> ").append(query.target().id())
                .append(" [").append(query.domain()).append("]\n");
        sb.append(String.format(Locale.ROOT, "  Score: %.4f  Confidence: %.4f", result.score(),
                result.confidence()));
        if (result.isTruncated())
            sb.append("  Truncated: ").append(result.truncation());
        if (result.belowConfidenceThreshold())
            sb.append("  (below confidence threshold)");
        sb.append('\n');

        List<PathExplanation> paths = result.explanation();
        sb.append("  Paths (").append(paths.size()).append(" of ").append(result.stats().pathsFound())
                .append("):\n");
        for (int i = 0; i < paths.size(); i++) {
            PathExplanation p = paths.get(i);
            sb.append(String.format(Locale.ROOT, "    #%d %s  hops=%d raw=%.4f discount=%.2f%n", i + 1,
                    String.join(" > ", p.principals()), p.hops(), p.rawConfidence(), p.appliedDiscount()));
        }

        sb.append("  Visited ").append(result.stats().nodesVisited()).append(" principals, examined ")
                .append(result.stats().edgesExamined()).append(" records\n");
        for (Map.Entry<ExclusionReason, Integer> e : result.stats().exclusions().entrySet())
            sb.append("    excluded ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        return sb.toString();
    }

    /**
     * Mermaid diagram of the explained paths. Each edge is labelled with the
     * ranks of the paths that use it.
     */
    public static String toMermaid(TrustQuery query, TrustResult result) {
        Map<String, Set<Integer>> edges = new LinkedHashMap<>();
        Set<String> nodes = new LinkedHashSet<>();
        List<PathExplanation> paths = result.explanation();
        for (int i = 0; i < paths.size(); i++) {
            List<String> ids = paths.get(i).principals();
            nodes.addAll(ids);
            for (int j = 0; j + 1 < ids.size(); j++)
                edges.computeIfAbsent(ids.get(j) + "\u0000" + ids.get(j + 1), k -> new LinkedHashSet<>()).add(i + 1);
            if (query.target().isSubject() && paths.get(i).hops() > ids.size() - 1) {
                String last = ids.get(ids.size() - 1);
                nodes.add(query.target().id());
                edges.computeIfAbsent(last + "\u0000" + query.target().id(), k -> new LinkedHashSet<>()).add(i + 1);
            }
        }

        StringBuilder sb = new StringBuilder(1024);
        sb.append("graph LR;\n");
        for (String n : nodes) {
            sb.append("  ").append(nodeId(n)).append("[\"").append(n.replace("\"", "'")).append("\"]");
            if (n.equals(query.source()))
                sb.append(":::source");
            sb.append(";\n");
        }
        for (Map.Entry<String, Set<Integer>> e : edges.entrySet()) {
            String[] ends = e.getKey().split("\u0000", 2);
            sb.append("  ").append(nodeId(ends[0])).append(" -->|");
            StringBuilder label = new StringBuilder();
            for (int rank : e.getValue()) {
                if (label.length() > 0)
                    label.append(',');
                label.append('#').append(rank);
            }
            sb.append(label).append("| ").append(nodeId(ends[1])).append(";\n");
        }
        sb.append("  classDef source fill:#d5f5e3;\n");
        return sb.toString();
    }

    private static String nodeId(String id) {
        return "n_" + id.replaceAll("[^A-Za-z0-9_]", "_");
    }
}
