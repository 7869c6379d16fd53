package io.cubedash.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.db.TimeOverviewRepo;
import io.cubedash.model.SpatialQuality;
import io.cubedash.summary.SummaryStore;
import io.javalin.Javalin;

import java.util.Locale;

/**
 * Audit views: stored dataset counts, spatial quality and day query timings.
 */
final class ApiRoutesAudit {
    private ApiRoutesAudit() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        SummaryStore store = api.store();

        app.get("/audit/dataset-counts", ctx -> {
            String cacheKey = "audit:dataset-counts";
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            ObjectNode out = om.createObjectNode();
            ArrayNode rows = out.putArray("counts");
            for (TimeOverviewRepo.PeriodCount c : store.getAllDatasetCounts()) {
                ObjectNode row = rows.addObject();
                row.put("product", c.productName());
                row.put("period", c.period().dbName());
                row.put("start_day", c.startDay().toString());
                row.put("dataset_count", c.datasetCount());
            }
            api.cacheAndRespond(ctx, cacheKey, out, 60, 120);
        });

        app.get("/product-audit", ctx -> {
            String cacheKey = "audit:product";
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            ObjectNode out = om.createObjectNode();
            ArrayNode rows = out.putArray("products");
            for (SpatialQuality q : store.spatialQualityStats()) {
                ObjectNode row = rows.addObject();
                row.put("product", q.productName());
                row.put("count", q.count());
                row.put("missing_footprint", q.missingFootprint());
                row.put("footprint_size", q.footprintSize());
                row.put("footprint_stddev", q.footprintStddev());
                row.put("missing_srid", q.missingSrid());
                row.put("has_file_size", q.hasFileSize());
                row.put("has_region", q.hasRegion());
            }
            api.cacheAndRespond(ctx, cacheKey, out, 60, 120);
        });

        app.get("/audit/day-query-times.txt", ctx -> {
            StringBuilder sb = new StringBuilder();
            for (SummaryStore.DayQueryTime t : store.dayQueryTimes()) {
                sb.append('"').append(t.productName()).append('"').append('\t')
                        .append(t.datasetCount()).append('\t')
                        .append(String.format(Locale.ROOT, "%.3f", t.seconds())).append('\n');
            }
            ctx.contentType("text/plain; charset=utf-8");
            ctx.result(sb.toString());
        });
    }
}
