package io.cubedash.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zaxxer.hikari.HikariDataSource;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKBWriter;
import org.locationtech.jts.io.geojson.GeoJsonWriter;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates, inspects and maintains the {@code cubedash} summary schema.
 */
public class SchemaRepo {
    private static final Logger log = LoggerFactory.getLogger(SchemaRepo.class);

    public static final String SCHEMA = "cubedash";

    private final HikariDataSource ds;
    private final CatalogTables catalog;
    private final Map<Integer, String> sridNames = new ConcurrentHashMap<>();

    public SchemaRepo(HikariDataSource ds, CatalogTables catalog) {
        this.ds = ds;
        this.catalog = catalog;
    }

    /**
     * Ordered DDL for the summary schema. Every statement is idempotent.
     */
    static List<String> schemaStatements() {
        return List.of(
                "CREATE EXTENSION IF NOT EXISTS postgis",
                "CREATE SCHEMA IF NOT EXISTS cubedash",

                "CREATE TABLE IF NOT EXISTS cubedash.product ("
                        + "id SMALLINT PRIMARY KEY, "
                        + "name TEXT NOT NULL UNIQUE, "
                        + "dataset_count INTEGER NOT NULL DEFAULT 0, "
                        + "time_earliest TIMESTAMPTZ, "
                        + "time_latest TIMESTAMPTZ, "
                        + "last_refresh TIMESTAMPTZ, "
                        + "last_successful_summary TIMESTAMPTZ, "
                        + "source_product_refs SMALLINT[], "
                        + "derived_product_refs SMALLINT[], "
                        + "fixed_metadata JSONB)",

                "CREATE TABLE IF NOT EXISTS cubedash.dataset_spatial ("
                        + "id UUID PRIMARY KEY, "
                        + "dataset_type_ref SMALLINT NOT NULL, "
                        + "center_time TIMESTAMPTZ NOT NULL, "
                        + "creation_time TIMESTAMPTZ, "
                        + "region_code TEXT, "
                        + "size_bytes BIGINT, "
                        + "footprint GEOMETRY)",
                "CREATE INDEX IF NOT EXISTS dataset_spatial_product_time_idx "
                        + "ON cubedash.dataset_spatial (dataset_type_ref, center_time)",
                "CREATE INDEX IF NOT EXISTS dataset_spatial_region_idx "
                        + "ON cubedash.dataset_spatial (dataset_type_ref, region_code)",
                "CREATE INDEX IF NOT EXISTS dataset_spatial_footprint_wgs84_idx "
                        + "ON cubedash.dataset_spatial USING gist (ST_Transform(footprint, 4326)) "
                        + "WHERE ST_SRID(footprint) > 0",

                "CREATE TABLE IF NOT EXISTS cubedash.time_overview ("
                        + "product_ref SMALLINT NOT NULL REFERENCES cubedash.product (id) ON DELETE CASCADE, "
                        + "start_day DATE NOT NULL, "
                        + "period_type TEXT NOT NULL CHECK (period_type IN ('all', 'year', 'month', 'day')), "
                        + "dataset_count INTEGER NOT NULL, "
                        + "time_earliest TIMESTAMPTZ, "
                        + "time_latest TIMESTAMPTZ, "
                        + "timeline_period TEXT NOT NULL, "
                        + "timeline_dataset_start_days DATE[] NOT NULL, "
                        + "timeline_dataset_counts INTEGER[] NOT NULL, "
                        + "regions TEXT[], "
                        + "region_dataset_counts INTEGER[], "
                        + "newest_dataset_creation_time TIMESTAMPTZ, "
                        + "crses TEXT[], "
                        + "size_bytes BIGINT, "
                        + "footprint_geometry GEOMETRY, "
                        + "footprint_count INTEGER NOT NULL DEFAULT 0, "
                        + "generation_time TIMESTAMPTZ NOT NULL DEFAULT now(), "
                        + "product_refresh_time TIMESTAMPTZ, "
                        + "PRIMARY KEY (product_ref, start_day, period_type))",

                "CREATE TABLE IF NOT EXISTS cubedash.region ("
                        + "dataset_type_ref SMALLINT NOT NULL, "
                        + "region_code TEXT NOT NULL, "
                        + "footprint GEOMETRY(Geometry, 4326), "
                        + "count INTEGER NOT NULL, "
                        + "generation_time TIMESTAMPTZ NOT NULL DEFAULT now(), "
                        + "PRIMARY KEY (dataset_type_ref, region_code))",

                "CREATE TABLE IF NOT EXISTS cubedash.refresh_run ("
                        + "run_id UUID PRIMARY KEY, "
                        + "job_name TEXT NOT NULL, "
                        + "product_name TEXT, "
                        + "started_at TIMESTAMPTZ NOT NULL, "
                        + "finished_at TIMESTAMPTZ, "
                        + "status TEXT NOT NULL, "
                        + "notes TEXT)",
                "CREATE INDEX IF NOT EXISTS refresh_run_started_idx ON cubedash.refresh_run (started_at DESC)",

                "CREATE MATERIALIZED VIEW IF NOT EXISTS cubedash.mv_dataset_spatial_quality AS "
                        + "SELECT dataset_type_ref, "
                        + "count(*) AS count, "
                        + "count(*) FILTER (WHERE footprint IS NULL) AS missing_footprint, "
                        + "coalesce(sum(ST_MemSize(footprint)) FILTER (WHERE footprint IS NOT NULL), 0) AS footprint_size, "
                        + "coalesce(stddev(ST_MemSize(footprint)) FILTER (WHERE footprint IS NOT NULL), 0) AS footprint_stddev, "
                        + "count(*) FILTER (WHERE footprint IS NOT NULL AND ST_SRID(footprint) = 0) AS missing_srid, "
                        + "count(*) FILTER (WHERE size_bytes IS NOT NULL) AS has_file_size, "
                        + "count(*) FILTER (WHERE region_code IS NOT NULL) AS has_region "
                        + "FROM cubedash.dataset_spatial GROUP BY dataset_type_ref",
                "CREATE UNIQUE INDEX IF NOT EXISTS mv_dataset_spatial_quality_product_idx "
                        + "ON cubedash.mv_dataset_spatial_quality (dataset_type_ref)");
    }

    /**
     * Creates the summary schema if needed. Safe to rerun.
     */
    public void initSchema(int groupingEpsg) throws SQLException {
        log.info("Initialising schema {} (grouping EPSG:{})", SCHEMA, groupingEpsg);
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (Statement st = c.createStatement()) {
                for (String sql : schemaStatements()) {
                    st.execute(sql);
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        }
        if (sridName(groupingEpsg) == null) {
            throw new IllegalStateException("Grouping EPSG:" + groupingEpsg + " is not in spatial_ref_sys");
        }
        log.info("Schema {} ready", SCHEMA);
    }

    /**
     * Drops the summary schema and everything in it.
     */
    public void dropSchema() throws SQLException {
        log.warn("Dropping schema {}", SCHEMA);
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute("DROP SCHEMA IF EXISTS cubedash CASCADE");
        }
    }

    /**
     * Do our DB schemas exist?
     */
    public boolean schemaInitialised() throws SQLException {
        String sql = "SELECT EXISTS (SELECT 1 FROM information_schema.tables "
                + "WHERE table_schema = 'cubedash' AND table_name = 'time_overview')";
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            return rs.next() && rs.getBoolean(1);
        }
    }

    public String postgisVersion() throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT postgis_lib_version()");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    /**
     * Whether the existing schema has the latest columns, and (when writing) the
     * catalog has the {@code updated} column that incremental refresh relies on.
     */
    public boolean isCompatible(boolean forWritingOperationsToo) throws SQLException {
        String sql = "SELECT count(*) FROM information_schema.columns WHERE "
                + "(table_schema = 'cubedash' AND table_name = 'dataset_spatial' AND column_name = 'creation_time') "
                + "OR (table_schema = 'cubedash' AND table_name = 'product' AND column_name = 'fixed_metadata') "
                + "OR (table_schema = ? AND table_name = 'dataset' AND column_name = 'updated')";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, catalog.schema());
            try (ResultSet rs = ps.executeQuery()) {
                int found = rs.next() ? rs.getInt(1) : 0;
                return forWritingOperationsToo ? found == 3 : found >= 2;
            }
        }
    }

    /**
     * Refresh general statistics tables that cover all products.
     *
     * <p>
     * This is ideally done once after all needed products have been refreshed.
     * </p>
     */
    public void refreshStats(boolean concurrently) throws SQLException {
        long t0 = System.currentTimeMillis();
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            st.execute("REFRESH MATERIALIZED VIEW " + (concurrently ? "CONCURRENTLY " : "")
                    + "cubedash.mv_dataset_spatial_quality");
        }
        log.info("Refreshed supporting views in {} ms", System.currentTimeMillis() - t0);
    }

    /**
     * Convert an internal postgres srid key to a string auth code: eg: 'EPSG:1234'
     */
    public String sridName(int srid) throws SQLException {
        String cached = sridNames.get(srid);
        if (cached != null)
            return cached;
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "SELECT upper(auth_name) || ':' || auth_srid FROM spatial_ref_sys WHERE srid = ?")) {
            ps.setInt(1, srid);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return null;
                String name = rs.getString(1);
                sridNames.put(srid, name);
                return name;
            }
        }
    }

    /**
     * GeoJSON of a footprint in EPSG:4326, simplified to about 10 m. Returns null
     * for a missing footprint.
     */
    public String toWgs84GeoJson(Geometry footprint, Integer srid) throws SQLException {
        if (footprint == null || footprint.isEmpty() || srid == null || srid <= 0)
            return null;
        if (srid == 4326) {
            GeoJsonWriter writer = new GeoJsonWriter(6);
            writer.setEncodeCRS(false);
            return writer.write(TopologyPreservingSimplifier.simplify(footprint, 0.0001));
        }
        String sql = "SELECT ST_AsGeoJSON(ST_SimplifyPreserveTopology("
                + "ST_Transform(ST_SetSRID(ST_GeomFromWKB(?), ?), 4326), 0.0001), 6)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setBytes(1, new WKBWriter().write(footprint));
            ps.setInt(2, srid);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }
}
