package io.cubedash.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.config.AppConfig;
import io.cubedash.stac.StacSearchRequest;
import io.cubedash.stac.StacService;
import io.javalin.Javalin;

import java.util.UUID;

/**
 * STAC API: root catalog, collections, items and item search.
 */
final class ApiRoutesStac {
    static final String GEOJSON = "application/geo+json";

    private ApiRoutesStac() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        AppConfig cfg = api.cfg();
        StacService stac = api.stac();

        app.get("/stac", ctx -> {
            String cacheKey = "stac:root:" + api.baseUrl(ctx);
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            api.cacheAndRespond(ctx, cacheKey, stac.root(api.baseUrl(ctx)), 60, 120);
        });

        app.get("/stac/collections", ctx -> {
            String cacheKey = "stac:collections:" + api.baseUrl(ctx);
            if (api.serveCached(ctx, cacheKey)) {
                return;
            }
            api.cacheAndRespond(ctx, cacheKey, stac.collections(api.baseUrl(ctx)), 60, 120);
        });

        app.get("/stac/collections/{collection}", ctx -> {
            String name = ctx.pathParam("collection");
            ObjectNode c = stac.collection(api.baseUrl(ctx), name)
                    .orElseThrow(() -> new NotFoundException("No collection " + name));
            ctx.json(c);
        });

        app.get("/stac/collections/{collection}/items", ctx -> {
            String name = ctx.pathParam("collection");
            if (stac.collection(api.baseUrl(ctx), name).isEmpty())
                throw new NotFoundException("No collection " + name);
            StacSearchRequest req = StacSearchRequest
                    .fromQuery(ctx.queryParamMap(), cfg.defaultApiLimit(), cfg.hardApiLimit())
                    .withCollection(name);
            ctx.contentType(GEOJSON);
            ctx.result(om.writeValueAsString(stac.search(api.baseUrl(ctx), ctx.path(), req, "GET")));
        });

        app.get("/stac/collections/{collection}/items/{id}", ctx -> {
            String name = ctx.pathParam("collection");
            UUID id = QueryParser.uuid(ctx.pathParam("id"));
            ObjectNode item = stac.item(api.baseUrl(ctx), name, id)
                    .orElseThrow(() -> new NotFoundException("No item " + id + " in " + name));
            ctx.contentType(GEOJSON);
            ctx.result(om.writeValueAsString(item));
        });

        app.get("/stac/search", ctx -> {
            StacSearchRequest req = StacSearchRequest.fromQuery(ctx.queryParamMap(), cfg.defaultApiLimit(),
                    cfg.hardApiLimit());
            ctx.contentType(GEOJSON);
            ctx.result(om.writeValueAsString(stac.search(api.baseUrl(ctx), "/stac/search", req, "GET")));
        });

        app.post("/stac/search", ctx -> {
            JsonNode body;
            try {
                body = ctx.body().isBlank() ? null : om.readTree(ctx.body());
            } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
                throw new BadRequestException("Search body is not valid JSON", e);
            }
            StacSearchRequest req = StacSearchRequest.fromJson(body, cfg.defaultApiLimit(), cfg.hardApiLimit());
            ctx.contentType(GEOJSON);
            ctx.result(om.writeValueAsString(stac.search(api.baseUrl(ctx), "/stac/search", req, "POST")));
        });
    }
}
