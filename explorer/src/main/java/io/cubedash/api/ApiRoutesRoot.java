package io.cubedash.api;

import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.db.SchemaRepo;
import io.javalin.Javalin;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Service index, and a health check covering the database and the summary schema.
 */
final class ApiRoutesRoot {
    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        HikariDataSource ds = api.ds();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "cubedash",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /products",
                        "GET /products.txt",
                        "GET /products/{product}[/{year}[/{month}[/{day}]]]",
                        "GET /products/{product}/datasets?time-begin=2017-10-01&limit=20",
                        "GET /api/footprint/{product}[/{year}[/{month}[/{day}]]]",
                        "GET /api/regions/{product}[/{year}[/{month}[/{day}]]]",
                        "GET /product/{product}/regions/{region}",
                        "GET /region/{region}",
                        "GET /dataset/{id}",
                        "GET /arrivals?days=14",
                        "GET /audit/dataset-counts",
                        "GET /audit/day-query-times.txt",
                        "GET /product-audit",
                        "GET /api/refresh/runs",
                        "GET /api/metrics/routes",
                        "GET /stac",
                        "GET|POST /stac/search"
                })));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());

            try (Connection c = ds.getConnection();
                    PreparedStatement ps = c.prepareStatement("SELECT 1");
                    ResultSet rs = ps.executeQuery()) {
                out.put("db", rs.next() ? "ok" : "unknown");
                SchemaRepo schema = api.store().schema();
                out.put("postgis", schema.postgisVersion());
                if (!schema.schemaInitialised())
                    out.put("schema", "missing");
                else
                    out.put("schema", schema.isCompatible(false) ? "ready" : "outdated");
            } catch (Exception e) {
                out.put("status", "degraded");
                out.put("db", "fail");
                out.put("db_error", e.getMessage());
                ctx.status(503);
            }

            ctx.json(out);
        });
    }
}
