package com.ttp.trust;

import com.ttp.trust.api.TrustQuery;
import com.ttp.trust.api.TrustResult;
import com.ttp.trust.api.TrustTarget;
import com.ttp.trust.util.LatencyTrackingListener;
import com.ttp.trust.util.ResultExplain;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads the bundled demo graph and answers a few queries.
 *
 * <p>
 * Pass a port number to keep the HTTP endpoint running afterwards, e.g.
 * {@code TrustGraphDemo 7070}, then
 * {@code curl -XPOST localhost:7070/api/trust/query -H 'X-Principal-Id: alice'
 * -d '{"target":"joes-diner","targetKind":"subject","domain":"food.restaurants"}'}.
 */
public class TrustGraphDemo {
    private static final Logger log = LogManager.getLogger(TrustGraphDemo.class);

    public static void main(String[] args) throws Exception {
        TrustGraph graph = TrustGraph.fromFixture("/demo-graph.json");
        LatencyTrackingListener latency = graph.enableLatencyTracking();
        graph.enableExclusionCounting();

        TrustQuery[] queries = {
                TrustQuery.of("alice", TrustTarget.principal("carol"), "food"),
                TrustQuery.of("alice", TrustTarget.principal("dave"), "food.restaurants"),
                TrustQuery.of("alice", TrustTarget.subject("joes-diner"), "food.restaurants"),
                TrustQuery.of("alice", TrustTarget.subject("mallory-burgers"), "food.restaurants"),
                TrustQuery.of("alice", TrustTarget.principal("erin"), "tech"),
        };
        for (TrustQuery q : queries) {
            TrustResult result = graph.query(q);
            log.info("\n{}", ResultExplain.explain(q, result));
        }
        log.info("Paths behind alice -> joes-diner:\n{}",
                ResultExplain.toMermaid(queries[2], graph.query(queries[2])));
        log.info("\n{}", latency.dump());

        if (args.length > 0) {
            int port = Integer.parseInt(args[0]);
            graph.startQueryServer(port);
            log.info("Query endpoint listening on {}; Ctrl-C to stop", port);
            Runtime.getRuntime().addShutdownHook(new Thread(graph::close));
            Thread.currentThread().join();
        } else {
            graph.close();
        }
    }
}
