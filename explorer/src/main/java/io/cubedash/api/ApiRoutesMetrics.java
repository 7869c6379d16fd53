package io.cubedash.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.metrics.RouteMetrics;
import io.javalin.Javalin;

/**
 * Per-route request counts and latency over the last hour.
 */
final class ApiRoutesMetrics {
    private ApiRoutesMetrics() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/metrics/routes", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", RouteMetrics.windowMinutes());
            ArrayNode routes = out.putArray("routes");

            for (var e : RouteMetrics.snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = routes.addObject();
                row.put("route", e.getKey());
                row.put("requests_last_hour", snap.requests());
                row.put("failures_last_hour", snap.failures());
                row.put("failure_pct", snap.failurePct());
                row.put("avg_ms", snap.avgMillis());
                row.put("max_ms", snap.maxMillis());
                row.put("status", snap.status());
            }

            ctx.json(out);
        });
    }
}
