package io.cubedash.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.config.AppConfig;
import io.cubedash.model.*;
import io.cubedash.summary.SummaryJson;
import io.cubedash.summary.SummaryStore;
import io.cubedash.summary.TimePeriodOverview;
import io.javalin.Javalin;
import io.javalin.http.Handler;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Product listings, per-period product summaries and dataset search within a product.
 */
final class ApiRoutesProducts {
    private ApiRoutesProducts() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppConfig cfg = api.cfg();
        SummaryStore store = api.store();

        // doubles as a liveness check: fails when nothing is summarised
        app.get("/products", ctx -> {
            String cacheKey = "products:list";
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            ObjectNode out = om.createObjectNode();
            ArrayNode products = out.putArray("products");
            for (ProductSummary p : store.listProducts())
                products.add(SummaryJson.product(om, p));
            api.cacheAndRespond(ctx, cacheKey, out, 60, 120);
        });

        app.get("/products.txt", ctx -> {
            StringBuilder sb = new StringBuilder();
            for (ProductSummary p : store.listCompleteProducts())
                sb.append(p.name()).append('\n');
            ctx.contentType("text/plain; charset=utf-8");
            ctx.result(sb.toString());
        });

        // registered before /{year} so "datasets" is not read as a year
        app.get("/products/{product}/datasets", ctx -> {
            String name = ctx.pathParam("product");
            if (store.getProductSummary(name).isEmpty())
                throw new NotFoundException("Unknown product " + name);

            Map<String, List<String>> params = ctx.queryParamMap();
            Map<String, SearchField> fields = store.searchFields(name);
            TimeRange time = QueryParser.timeRange(params, store.zone());
            List<FieldFilter> filters = QueryParser.fieldFilters(params, fields, store.zone());
            double[] bbox = QueryParser.bbox(ctx.queryParam("bbox"));
            int limit = ApiServer.parseInt(ctx.queryParam("limit"), cfg.defaultApiLimit(), 1, cfg.hardApiLimit());
            int offset = ApiServer.parseInt(ctx.queryParam("offset"), 0, 0, Integer.MAX_VALUE);

            // one extra row tells whether another page exists
            DatasetQuery q = new DatasetQuery(List.of(name), List.of(), bbox, time, filters, limit + 1, offset,
                    false);
            List<DatasetItem> items = store.searchDatasets(q);
            boolean more = items.size() > limit;
            if (more)
                items = items.subList(0, limit);

            ObjectNode out = om.createObjectNode();
            out.put("product", name);
            ObjectNode t = out.putObject("time");
            api.putNullable(t, "begin", time == null ? null : time.begin());
            api.putNullable(t, "end", time == null ? null : time.end());
            ArrayNode applied = out.putArray("filters");
            for (FieldFilter f : filters) {
                ObjectNode row = applied.addObject();
                row.put("field", f.field().name());
                api.putNullable(row, "begin", f.begin());
                api.putNullable(row, "end", f.end());
            }
            ArrayNode searchable = out.putArray("search_fields");
            fields.keySet().forEach(searchable::add);
            out.put("limit", limit);
            out.put("offset", offset);
            out.put("has_more", more);
            ArrayNode datasets = out.putArray("datasets");
            for (DatasetItem d : items)
                datasets.add(api.datasetJson(d));
            ctx.json(out);
        });

        Handler summary = ctx -> {
            String cacheKey = "summary:" + ApiServer.cacheKey(ctx);
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            String name = ctx.pathParam("product");
            QueryParser.PeriodArgs period = ApiServer.periodOf(ctx);
            Optional<ProductSummary> product = store.getProductSummary(name);
            if (product.isEmpty())
                throw new NotFoundException("Unknown product " + name);
            Optional<TimePeriodOverview> s = store.get(name, period.year(), period.month(), period.day());

            ObjectNode out = om.createObjectNode();
            out.set("product", SummaryJson.product(om, product.get()));
            ObjectNode p = out.putObject("period");
            api.putNullable(p, "year", period.year());
            api.putNullable(p, "month", period.month());
            api.putNullable(p, "day", period.day());
            if (s.isPresent())
                out.set("summary", SummaryJson.overview(om, s.get()));
            else
                out.putNull("summary");
            api.cacheAndRespond(ctx, cacheKey, out, 60, 120);
        };
        app.get("/products/{product}", summary);
        app.get("/products/{product}/{year}", summary);
        app.get("/products/{product}/{year}/{month}", summary);
        app.get("/products/{product}/{year}/{month}/{day}", summary);
    }
}
