package io.cubedash.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.config.AppConfig;
import io.cubedash.metrics.RouteMetrics;
import io.cubedash.model.DatasetItem;
import io.cubedash.model.NoSummariesException;
import io.cubedash.stac.StacService;
import io.cubedash.summary.SummaryStore;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * HTTP API: product summaries, footprints and regions, datasets, audits and
 * a STAC endpoint. Routes are registered per area by the {@code ApiRoutes*}
 * classes.
 */
public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final HikariDataSource ds;
    private final SummaryStore store;
    private final StacService stac;
    private Javalin app;
    private final Map<String, CachedResponse> responseCache = new ConcurrentHashMap<>();

    public ApiServer(AppConfig cfg, ObjectMapper om, HikariDataSource ds, SummaryStore store) {
        this.cfg = cfg;
        this.om = om;
        this.ds = ds;
        this.store = store;
        this.stac = new StacService(cfg, om, store);
    }

    public void start() {
        start(cfg.apiPort());
    }

    /**
     * Starts on the given port; 0 picks a free one (see {@link #port()}).
     */
    public void start(int port) {
        log.info("Starting API server on port {}", port);
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            if (cfg.corsEnabled())
                j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // request logging, start time for latency
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            if (cfg.showPerfTimes() && ms >= 0)
                ctx.header("Server-Timing", "app;dur=" + ms);
            RouteMetrics.record(routeOf(ctx), ctx.status().getCode(), ms);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(BadRequestException.class, (e, ctx) -> error(ctx, 400, "bad_request", e.getMessage()));
        app.exception(NotFoundException.class, (e, ctx) -> error(ctx, 404, "not_found", e.getMessage()));
        app.exception(NoSummariesException.class,
                (e, ctx) -> error(ctx, 503, "no_summaries", e.getMessage()));
        app.exception(HttpResponseException.class,
                (e, ctx) -> error(ctx, e.getStatus(), "http_" + e.getStatus(), e.getMessage()));
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            error(ctx, 500, "internal_error", e.getMessage() == null ? "Unknown error" : e.getMessage());
        });

        ApiRoutesRoot.register(this);
        ApiRoutesProducts.register(this);
        ApiRoutesGeo.register(this);
        ApiRoutesDatasets.register(this);
        ApiRoutesAudit.register(this);
        ApiRoutesRefresh.register(this);
        ApiRoutesMetrics.register(this);
        ApiRoutesStac.register(this);

        app.start(port);
    }

    /**
     * The port actually listened on.
     */
    public int port() {
        return app.port();
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    AppConfig cfg() {
        return cfg;
    }

    HikariDataSource ds() {
        return ds;
    }

    SummaryStore store() {
        return store;
    }

    StacService stac() {
        return stac;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------
    private void error(Context ctx, int status, String code, String message) {
        ctx.status(status).json(om.createObjectNode()
                .put("error", code)
                .put("message", message)
                .put("timestamp", OffsetDateTime.now().toString()));
    }

    private static String routeOf(Context ctx) {
        String path;
        try {
            path = ctx.endpointHandlerPath();
        } catch (RuntimeException e) {
            // no endpoint matched
            path = null;
        }
        return path == null || path.isBlank() ? "(unmatched)" : ctx.method() + " " + path;
    }

    /**
     * Absolute URL prefix for links: the configured base URL, or the request's own.
     */
    String baseUrl(Context ctx) {
        if (!cfg.baseUrl().isBlank())
            return cfg.baseUrl();
        return ctx.scheme() + "://" + ctx.host();
    }

    private static class CachedResponse {
        final String body;
        final long expiresAt;
        final String etag;
        final int maxAgeSeconds;
        final int staleSeconds;

        CachedResponse(String body, long expiresAt, String etag, int maxAgeSeconds, int staleSeconds) {
            this.body = body;
            this.expiresAt = expiresAt;
            this.etag = etag;
            this.maxAgeSeconds = maxAgeSeconds;
            this.staleSeconds = staleSeconds;
        }
    }

    /**
     * Answers from the cache, with 304 when the client's ETag still matches.
     *
     * @return whether the request was answered
     */
    boolean serveCached(Context ctx, String key) {
        CachedResponse cached = responseCache.get(key);
        if (cached == null) {
            return false;
        }
        if (cached.expiresAt <= System.currentTimeMillis()) {
            responseCache.remove(key);
            return false;
        }

        applyCacheHeaders(ctx, cached.maxAgeSeconds, cached.staleSeconds);
        ctx.header("ETag", cached.etag);
        if (cached.etag.equals(ctx.header("If-None-Match"))) {
            ctx.status(304);
            return true;
        }
        ctx.contentType("application/json");
        ctx.result(cached.body);
        return true;
    }

    void cacheAndRespond(Context ctx, String key, JsonNode node, int maxAgeSeconds, int staleSeconds)
            throws Exception {
        String body = om.writeValueAsString(node);
        String etag = "\"" + Integer.toHexString(body.hashCode()) + "\"";
        long expiresAt = System.currentTimeMillis() + (maxAgeSeconds * 1000L);
        responseCache.put(key, new CachedResponse(body, expiresAt, etag, maxAgeSeconds, staleSeconds));
        applyCacheHeaders(ctx, maxAgeSeconds, staleSeconds);
        ctx.header("ETag", etag);
        if (etag.equals(ctx.header("If-None-Match"))) {
            ctx.status(304);
            return;
        }
        ctx.contentType("application/json");
        ctx.result(body);
    }

    private void applyCacheHeaders(Context ctx, int maxAgeSeconds, int staleSeconds) {
        if (maxAgeSeconds <= 0) {
            return;
        }
        StringBuilder sb = new StringBuilder("public, max-age=").append(maxAgeSeconds);
        if (staleSeconds > 0) {
            sb.append(", stale-while-revalidate=").append(staleSeconds);
        }
        ctx.header("Cache-Control", sb.toString());
    }

    /**
     * Cache key for a request: its path and query string.
     */
    static String cacheKey(Context ctx) {
        String q = ctx.queryString();
        return q == null || q.isEmpty() ? ctx.path() : ctx.path() + "?" + q;
    }

    /**
     * The optional {@code year}/{@code month}/{@code day} path parameters.
     */
    static QueryParser.PeriodArgs periodOf(Context ctx) {
        Map<String, String> p = ctx.pathParamMap();
        return QueryParser.period(p.get("year"), p.get("month"), p.get("day"));
    }

    ObjectNode datasetJson(DatasetItem d) {
        ObjectNode o = om.createObjectNode();
        o.put("id", d.id().toString());
        o.put("product", d.productName());
        putNullable(o, "center_time", d.centerTime());
        putNullable(o, "creation_time", d.creationTime());
        putNullable(o, "region_code", d.regionCode());
        putNullable(o, "size_bytes", d.sizeBytes());
        putNullable(o, "location", d.locationUri());
        if (d.bbox() == null) {
            o.putNull("bbox");
        } else {
            ArrayNode bbox = o.putArray("bbox");
            for (double v : d.bbox())
                bbox.add(v);
        }
        if (d.geometry() == null)
            o.putNull("geometry");
        else
            o.set("geometry", d.geometry());
        return o;
    }

    void putNullable(ObjectNode obj, String key, Object value) {
        if (value == null)
            obj.putNull(key);
        else if (value instanceof Long l)
            obj.put(key, l);
        else if (value instanceof Integer i)
            obj.put(key, i);
        else if (value instanceof Number n)
            obj.put(key, n.doubleValue());
        else if (value instanceof Instant t)
            obj.put(key, t.toString());
        else
            obj.put(key, value.toString());
    }

    /**
     * Lenient integer argument: the default when absent or unreadable, clamped to range.
     */
    static Integer parseInt(String s, Integer def, int min, int max) {
        if (s == null || s.isBlank())
            return def;
        try {
            int v = Integer.parseInt(s.trim());
            if (v < min)
                v = min;
            if (v > max)
                v = max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
