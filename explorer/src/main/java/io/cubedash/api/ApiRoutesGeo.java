package io.cubedash.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.summary.SummaryStore;
import io.cubedash.summary.TimePeriodOverview;
import io.javalin.Javalin;
import io.javalin.http.Handler;

import java.util.Optional;

/**
 * GeoJSON footprints and region counts of a product period, in EPSG:4326.
 */
final class ApiRoutesGeo {
    private ApiRoutesGeo() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        SummaryStore store = api.store();

        Handler footprint = ctx -> {
            String cacheKey = "footprint:" + ApiServer.cacheKey(ctx);
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            String name = ctx.pathParam("product");
            QueryParser.PeriodArgs period = ApiServer.periodOf(ctx);
            Optional<TimePeriodOverview> s = store.get(name, period.year(), period.month(), period.day());
            if (s.isEmpty())
                throw new NotFoundException("No summary for " + name + " " + describe(period));

            ObjectNode feature = om.createObjectNode();
            feature.put("type", "Feature");
            Optional<String> geometry = store.footprintGeoJson(s.get());
            if (geometry.isPresent())
                feature.set("geometry", om.readTree(geometry.get()));
            else
                feature.putNull("geometry");
            ObjectNode props = feature.putObject("properties");
            props.put("product_name", name);
            props.put("time_spec", describe(period));
            props.put("dataset_count", s.get().datasetCount());
            props.put("footprint_count", s.get().footprintCount());
            api.cacheAndRespond(ctx, cacheKey, feature, 60, 120);
        };
        app.get("/api/footprint/{product}", footprint);
        app.get("/api/footprint/{product}/{year}", footprint);
        app.get("/api/footprint/{product}/{year}/{month}", footprint);
        app.get("/api/footprint/{product}/{year}/{month}/{day}", footprint);

        Handler regions = ctx -> {
            String cacheKey = "regions:" + ApiServer.cacheKey(ctx);
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            String name = ctx.pathParam("product");
            QueryParser.PeriodArgs period = ApiServer.periodOf(ctx);
            ObjectNode fc = store.regionsGeoJson(name, period.year(), period.month(), period.day());
            if (fc == null)
                throw new NotFoundException("No regions for " + name + " " + describe(period));
            api.cacheAndRespond(ctx, cacheKey, fc, 60, 120);
        };
        app.get("/api/regions/{product}", regions);
        app.get("/api/regions/{product}/{year}", regions);
        app.get("/api/regions/{product}/{year}/{month}", regions);
        app.get("/api/regions/{product}/{year}/{month}/{day}", regions);
    }

    static String describe(QueryParser.PeriodArgs p) {
        if (p.year() == null)
            return "all time";
        if (p.month() == null)
            return String.valueOf(p.year());
        if (p.day() == null)
            return String.format("%d-%02d", p.year(), p.month());
        return String.format("%d-%02d-%02d", p.year(), p.month(), p.day());
    }
}
