package io.cubedash.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.model.RefreshRun;
import io.cubedash.summary.SummaryStore;
import io.javalin.Javalin;

/**
 * The summary refresh run log.
 */
final class ApiRoutesRefresh {
    private ApiRoutesRefresh() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        SummaryStore store = api.store();

        app.get("/api/refresh/runs", ctx -> {
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), 50, 1, 500);
            String product = ctx.queryParam("product");
            if (product != null && product.isBlank())
                product = null;

            ObjectNode out = om.createObjectNode();
            ArrayNode runs = out.putArray("runs");
            for (RefreshRun r : store.recentRuns(product, limit)) {
                ObjectNode row = runs.addObject();
                row.put("run_id", r.runId().toString());
                row.put("job_name", r.jobName());
                api.putNullable(row, "product", r.productName());
                api.putNullable(row, "started_at", r.startedAt());
                api.putNullable(row, "finished_at", r.finishedAt());
                row.put("status", r.status());
                api.putNullable(row, "notes", r.notes());
            }
            ctx.json(out);
        });
    }
}
