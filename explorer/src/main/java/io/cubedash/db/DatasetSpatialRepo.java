package io.cubedash.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.model.DatasetItem;
import io.cubedash.model.DatasetQuery;
import io.cubedash.model.FieldFilter;
import io.cubedash.model.SearchField;
import io.cubedash.model.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The per-dataset spatial table ({@code cubedash.dataset_spatial}): filled from
 * the catalog, and queried for listings, regions and STAC searches.
 */
public class DatasetSpatialRepo {
    private static final Logger log = LoggerFactory.getLogger(DatasetSpatialRepo.class);

    private final HikariDataSource ds;
    private final ObjectMapper om;
    private final CatalogTables t;

    public DatasetSpatialRepo(HikariDataSource ds, ObjectMapper om, CatalogTables tables) {
        this.ds = ds;
        this.om = om;
        this.t = tables;
    }

    /** Earliest and latest center time, and count, of a product's rows. */
    public record ProductExtent(Instant earliest, Instant latest, long count) {
    }

    /** A dataset's footprint (GeoJSON, EPSG:4326) and region. */
    public record FootprintRegion(JsonNode footprint, String regionCode) {
    }

    /**
     * Inserts or updates rows for a product's active datasets, computing each
     * field from the dataset document. With {@code afterDate}, only datasets
     * added or updated since then are touched.
     *
     * @return rows written
     */
    public int upsertDatasets(int productId, DatasetExtentSql ext, Instant afterDate) throws Exception {
        String center = ext.centerTime();
        StringBuilder sql = new StringBuilder()
                .append("INSERT INTO cubedash.dataset_spatial ")
                .append("(id, dataset_type_ref, center_time, creation_time, region_code, size_bytes, footprint) ")
                .append("SELECT d.id, d.").append(t.datasetProductRef()).append(", ")
                .append(center).append(", ")
                .append(ext.creationTime()).append(", ")
                .append(ext.regionCode()).append(", ")
                .append(ext.sizeBytes()).append(", ")
                .append(ext.footprint()).append(" ")
                .append("FROM ").append(t.dataset()).append(" d ")
                .append("WHERE d.").append(t.datasetProductRef()).append(" = ? AND d.archived IS NULL ")
                .append("AND (").append(center).append(") IS NOT NULL ");
        if (afterDate != null) {
            sql.append("AND greatest(d.added, d.updated) > ? ");
        }
        sql.append("ON CONFLICT (id) DO UPDATE SET ")
                .append("dataset_type_ref = EXCLUDED.dataset_type_ref, ")
                .append("center_time = EXCLUDED.center_time, ")
                .append("creation_time = EXCLUDED.creation_time, ")
                .append("region_code = EXCLUDED.region_code, ")
                .append("size_bytes = EXCLUDED.size_bytes, ")
                .append("footprint = EXCLUDED.footprint");

        long t0 = System.currentTimeMillis();
        int n;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            ps.setInt(1, productId);
            if (afterDate != null)
                ps.setTimestamp(2, Timestamp.from(afterDate));
            n = ps.executeUpdate();
        }
        log.debug("upsertDatasets product={} after={} -> {} rows ({} ms)", productId, afterDate, n,
                System.currentTimeMillis() - t0);
        return n;
    }

    /**
     * Removes rows of archived datasets. With {@code full}, also removes rows
     * whose dataset no longer exists in the catalog at all.
     *
     * @return rows deleted
     */
    public int deleteDatasets(int productId, Instant afterDate, boolean full) throws Exception {
        String sql;
        if (full) {
            sql = "DELETE FROM cubedash.dataset_spatial s WHERE s.dataset_type_ref = ? AND NOT EXISTS ("
                    + "SELECT 1 FROM " + t.dataset() + " d WHERE d.id = s.id AND d.archived IS NULL "
                    + "AND d." + t.datasetProductRef() + " = s.dataset_type_ref)";
        } else {
            sql = "DELETE FROM cubedash.dataset_spatial s WHERE s.dataset_type_ref = ? AND s.id IN ("
                    + "SELECT d.id FROM " + t.dataset() + " d WHERE d." + t.datasetProductRef() + " = ? "
                    + "AND d.archived IS NOT NULL" + (afterDate != null ? " AND d.archived > ?" : "") + ")";
        }
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            if (!full) {
                ps.setInt(2, productId);
                if (afterDate != null)
                    ps.setTimestamp(3, Timestamp.from(afterDate));
            }
            int n = ps.executeUpdate();
            log.debug("deleteDatasets product={} after={} full={} -> {}", productId, afterDate, full, n);
            return n;
        }
    }

    public ProductExtent productExtent(int productId) throws Exception {
        String sql = "SELECT min(center_time), max(center_time), count(*) "
                + "FROM cubedash.dataset_spatial WHERE dataset_type_ref = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new ProductExtent(CatalogRepo.toInstant(rs.getTimestamp(1)),
                        CatalogRepo.toInstant(rs.getTimestamp(2)), rs.getLong(3));
            }
        }
    }

    /**
     * Datasets of a product in one region, newest first.
     */
    public List<DatasetItem> datasetsByRegion(int productId, String regionCode, TimeRange time, int limit,
            int offset) throws Exception {
        StringBuilder sql = new StringBuilder(itemSelect(false))
                .append("WHERE s.dataset_type_ref = ? AND s.region_code = ? ");
        if (time != null && time.begin() != null)
            sql.append("AND s.center_time >= ? ");
        if (time != null && time.end() != null)
            sql.append("AND s.center_time < ? ");
        sql.append("ORDER BY s.center_time DESC, s.id LIMIT ? OFFSET ?");

        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            int i = 1;
            ps.setInt(i++, productId);
            ps.setString(i++, regionCode);
            if (time != null && time.begin() != null)
                ps.setTimestamp(i++, Timestamp.from(time.begin()));
            if (time != null && time.end() != null)
                ps.setTimestamp(i++, Timestamp.from(time.end()));
            ps.setInt(i++, limit);
            ps.setInt(i, offset);
            return readItems(ps, false);
        }
    }

    /**
     * Names of summarised products that have datasets in a region.
     */
    public List<String> productsByRegion(String regionCode, int limit, int offset) throws Exception {
        String sql = "SELECT p.name FROM cubedash.product p WHERE EXISTS ("
                + "SELECT 1 FROM cubedash.dataset_spatial s WHERE s.dataset_type_ref = p.id AND s.region_code = ?) "
                + "ORDER BY p.name LIMIT ? OFFSET ?";
        List<String> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, regionCode);
            ps.setInt(2, limit);
            ps.setInt(3, offset);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(rs.getString(1));
            }
        }
        return out;
    }

    /**
     * One page of datasets matching the query, newest first.
     */
    public List<DatasetItem> searchItems(DatasetQuery q) throws Exception {
        List<Object> params = new ArrayList<>();
        String where = whereClause(q, params);
        String sql = itemSelect(q.includeDocs()) + where + "ORDER BY s.center_time DESC, s.id LIMIT ? OFFSET ?";
        params.add(q.limit());
        params.add(q.offset());
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(c, ps, params);
            return readItems(ps, q.includeDocs());
        }
    }

    /**
     * Total matches for the query, ignoring paging.
     */
    public long countItems(DatasetQuery q) throws Exception {
        List<Object> params = new ArrayList<>();
        String sql = "SELECT count(*) FROM cubedash.dataset_spatial s "
                + "JOIN cubedash.product p ON p.id = s.dataset_type_ref "
                + "JOIN " + t.dataset() + " d ON d.id = s.id "
                + whereClause(q, params);
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(c, ps, params);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        }
    }

    public Optional<FootprintRegion> datasetFootprintRegion(UUID id) throws Exception {
        String sql = "SELECT CASE WHEN ST_SRID(footprint) > 0 THEN ST_AsGeoJSON(ST_Transform(footprint, 4326), 6) END, "
                + "region_code FROM cubedash.dataset_spatial WHERE id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next())
                    return Optional.empty();
                String geo = rs.getString(1);
                return Optional.of(new FootprintRegion(geo == null ? null : om.readTree(geo), rs.getString(2)));
            }
        }
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private String itemSelect(boolean includeDocs) {
        return "SELECT s.id, p.name AS product_name, s.center_time, s.creation_time, s.region_code, s.size_bytes, "
                + "ST_AsGeoJSON(w.g, 6) AS geom, ST_XMin(w.g) AS xmin, ST_YMin(w.g) AS ymin, "
                + "ST_XMax(w.g) AS xmax, ST_YMax(w.g) AS ymax, "
                + (includeDocs ? "d.metadata::text AS metadata, " : "NULL::text AS metadata, ")
                + "(SELECT l.uri_scheme || ':' || l.uri_body FROM " + t.location() + " l "
                + " WHERE l.dataset_ref = s.id AND l.archived IS NULL ORDER BY l.added DESC LIMIT 1) AS uri "
                + "FROM cubedash.dataset_spatial s "
                + "JOIN cubedash.product p ON p.id = s.dataset_type_ref "
                + "JOIN " + t.dataset() + " d ON d.id = s.id "
                + "LEFT JOIN LATERAL (SELECT ST_Transform(s.footprint, 4326) AS g "
                + " WHERE ST_SRID(s.footprint) > 0) w ON true ";
    }

    private String whereClause(DatasetQuery q, List<Object> params) {
        StringBuilder sb = new StringBuilder("WHERE true ");
        if (!q.products().isEmpty()) {
            sb.append("AND p.name = ANY(?) ");
            params.add(new SqlArray("text", q.products().toArray()));
        }
        if (!q.ids().isEmpty()) {
            sb.append("AND s.id = ANY(?) ");
            params.add(new SqlArray("uuid", q.ids().toArray()));
        }
        if (q.bbox() != null) {
            double[] b = q.bbox();
            sb.append("AND ST_SRID(s.footprint) > 0 AND ST_Transform(s.footprint, 4326) && ST_MakeEnvelope(?, ?, ?, ?, 4326) ");
            params.add(b[0]);
            params.add(b[1]);
            params.add(b[2]);
            params.add(b[3]);
        }
        if (q.time() != null && q.time().begin() != null) {
            sb.append("AND s.center_time >= ? ");
            params.add(Timestamp.from(q.time().begin()));
        }
        if (q.time() != null && q.time().end() != null) {
            sb.append("AND s.center_time < ? ");
            params.add(Timestamp.from(q.time().end()));
        }
        for (FieldFilter f : q.fields()) {
            appendFieldFilter(sb, params, f);
        }
        return sb.toString();
    }

    /**
     * Range fields match when the dataset's range overlaps the requested one.
     */
    static void appendFieldFilter(StringBuilder sb, List<Object> params, FieldFilter f) {
        SearchField field = f.field();
        String type = field.sqlType();
        if (field.isRange()) {
            if (f.begin() != null) {
                sb.append("AND ").append(docValue(field.maxOffset(), type)).append(" >= ?::").append(type).append(" ");
                params.add(f.begin());
            }
            if (f.end() != null) {
                sb.append("AND ").append(docValue(field.minOffset(), type)).append(" <= ?::").append(type).append(" ");
                params.add(f.end());
            }
        } else if (f.begin() != null) {
            sb.append("AND ").append(docValue(field.offset(), type)).append(" = ?::").append(type).append(" ");
            params.add(f.begin());
        }
    }

    private static String docValue(List<String> path, String type) {
        return "(d.metadata #>> " + jsonPath(path) + ")::" + type;
    }

    /**
     * A {@code text[]} literal for a JSON path. Keys are double-quoted and
     * escaped, so any character in a key is kept.
     */
    static String jsonPath(List<String> path) {
        StringBuilder p = new StringBuilder("'{");
        for (int i = 0; i < path.size(); i++) {
            if (i > 0)
                p.append(',');
            String key = path.get(i).replace("\\", "\\\\").replace("\"", "\\\"");
            p.append('"').append(key.replace("'", "''")).append('"');
        }
        return p.append("}'").toString();
    }

    private record SqlArray(String type, Object[] values) {
    }

    private static void bind(Connection c, PreparedStatement ps, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object v = params.get(i);
            if (v instanceof SqlArray a) {
                ps.setArray(i + 1, c.createArrayOf(a.type(), a.values()));
            } else {
                ps.setObject(i + 1, v);
            }
        }
    }

    private List<DatasetItem> readItems(PreparedStatement ps, boolean includeDocs) throws Exception {
        List<DatasetItem> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String geo = rs.getString("geom");
                double[] bbox = null;
                if (geo != null) {
                    bbox = new double[] { rs.getDouble("xmin"), rs.getDouble("ymin"), rs.getDouble("xmax"),
                            rs.getDouble("ymax") };
                }
                Object size = rs.getObject("size_bytes");
                String doc = includeDocs ? rs.getString("metadata") : null;
                out.add(new DatasetItem(
                        rs.getObject("id", UUID.class),
                        rs.getString("product_name"),
                        CatalogRepo.toInstant(rs.getTimestamp("center_time")),
                        CatalogRepo.toInstant(rs.getTimestamp("creation_time")),
                        rs.getString("region_code"),
                        size == null ? null : ((Number) size).longValue(),
                        geo == null ? null : om.readTree(geo),
                        bbox,
                        doc == null ? null : om.readTree(doc),
                        rs.getString("uri")));
            }
        }
        return out;
    }
}
