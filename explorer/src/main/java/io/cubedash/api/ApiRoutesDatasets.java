package io.cubedash.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.config.AppConfig;
import io.cubedash.model.*;
import io.cubedash.summary.SummaryStore;
import io.javalin.Javalin;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Datasets by region, single datasets with their lineage, and recent arrivals.
 */
final class ApiRoutesDatasets {
    /** Sources and derived datasets shown with a dataset. */
    static final int LINEAGE_DISPLAY_LIMIT = 20;

    private ApiRoutesDatasets() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppConfig cfg = api.cfg();
        SummaryStore store = api.store();

        app.get("/product/{product}/regions/{region}", ctx -> {
            String name = ctx.pathParam("product");
            String region = ctx.pathParam("region");
            if (store.getProductSummary(name).isEmpty())
                throw new NotFoundException("Unknown product " + name);
            TimeRange time = QueryParser.timeRange(ctx.queryParamMap(), store.zone());
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), cfg.defaultApiLimit(), 1, cfg.hardApiLimit());
            int offset = ApiServer.parseInt(ctx.queryParam("offset"), 0, 0, Integer.MAX_VALUE);

            List<DatasetItem> items = store.datasetsByRegion(name, region, time, limit + 1, offset);
            boolean more = items.size() > limit;
            if (more)
                items = items.subList(0, limit);

            ObjectNode out = om.createObjectNode();
            out.put("product", name);
            out.put("region_code", region);
            out.put("limit", limit);
            out.put("offset", offset);
            out.put("has_more", more);
            ArrayNode datasets = out.putArray("datasets");
            for (DatasetItem d : items)
                datasets.add(api.datasetJson(d));
            ctx.json(out);
        });

        app.get("/region/{region}", ctx -> {
            String region = ctx.pathParam("region");
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), cfg.defaultApiLimit(), 1, cfg.hardApiLimit());
            int offset = ApiServer.parseInt(ctx.queryParam("offset"), 0, 0, Integer.MAX_VALUE);
            ObjectNode out = om.createObjectNode();
            out.put("region_code", region);
            ArrayNode products = out.putArray("products");
            store.productsByRegion(region, limit, offset).forEach(products::add);
            ctx.json(out);
        });

        app.get("/dataset/{id}", ctx -> {
            UUID id = QueryParser.uuid(ctx.pathParam("id"));
            Optional<DatasetDetail> found = store.dataset(id);
            if (found.isEmpty())
                throw new NotFoundException("No dataset " + id);
            DatasetDetail d = found.get();

            ObjectNode out = om.createObjectNode();
            out.put("id", d.id().toString());
            out.put("product", d.productName());
            api.putNullable(out, "added", d.added());
            api.putNullable(out, "archived", d.archived());
            out.put("active", d.archived() == null);
            api.putNullable(out, "region_code", d.regionCode());
            ArrayNode locations = out.putArray("locations");
            d.locations().forEach(locations::add);
            if (d.footprint() == null)
                out.putNull("footprint");
            else
                out.set("footprint", d.footprint());
            out.set("sources", linked(om, store.datasetSources(id, LINEAGE_DISPLAY_LIMIT)));
            out.set("derived", linked(om, store.datasetsDerived(id, LINEAGE_DISPLAY_LIMIT)));
            if (d.metadata() == null)
                out.putNull("metadata");
            else
                out.set("metadata", d.metadata());
            ctx.json(out);
        });

        app.get("/arrivals", ctx -> {
            String cacheKey = "arrivals:" + ApiServer.cacheKey(ctx);
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            int days = ApiServer.parseInt(ctx.queryParam("days"), 14, 1, 365);
            ObjectNode out = om.createObjectNode();
            out.put("period_days", days);
            ArrayNode arrivals = out.putArray("arrivals");
            try {
                for (ArrivalRow r : store.latestArrivals(Duration.ofDays(days))) {
                    ObjectNode row = arrivals.addObject();
                    row.put("day", r.day().toString());
                    row.put("product", r.productName());
                    row.put("dataset_count", r.datasetCount());
                    ArrayNode sample = row.putArray("sample_ids");
                    r.sampleIds().forEach(s -> sample.add(s.toString()));
                }
            } catch (EmptyCatalogException e) {
                out.put("empty_catalog", true);
            }
            api.cacheAndRespond(ctx, cacheKey, out, 60, 120);
        });
    }

    private static ObjectNode linked(ObjectMapper om, LinkedDatasets linked) {
        ObjectNode out = om.createObjectNode();
        ArrayNode list = out.putArray("datasets");
        for (LinkedDatasets.Ref r : linked.datasets()) {
            ObjectNode row = list.addObject();
            row.put("id", r.id().toString());
            row.put("product", r.productName());
        }
        out.put("remaining", linked.remaining());
        return out;
    }
}
