package io.cubedash.db;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.model.CatalogProduct;
import io.cubedash.model.ProductSummary;
import io.cubedash.model.SpatialQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Per-product summary records ({@code cubedash.product}).
 */
public class ProductRepo {
    private static final Logger log = LoggerFactory.getLogger(ProductRepo.class);

    private final HikariDataSource ds;
    private final ObjectMapper om;
    private final CatalogTables t;

    public ProductRepo(HikariDataSource ds, ObjectMapper om, CatalogTables tables) {
        this.ds = ds;
        this.om = om;
        this.t = tables;
    }

    /**
     * Makes sure a row exists for the catalog product, keyed by its catalog id.
     * A stale row holding the same name under another id is removed first.
     *
     * @return the existing summary, if there was one
     */
    public Optional<ProductSummary> upsertProductRecord(CatalogProduct product) throws Exception {
        Optional<ProductSummary> existing = get(product.name());
        if (existing.isPresent() && existing.get().id() == product.id())
            return existing;

        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement del = c.prepareStatement("DELETE FROM cubedash.product WHERE name = ? AND id <> ?");
                    PreparedStatement ins = c.prepareStatement(
                            "INSERT INTO cubedash.product (id, name) VALUES (?, ?) "
                                    + "ON CONFLICT (id) DO UPDATE SET name = EXCLUDED.name")) {
                del.setString(1, product.name());
                del.setInt(2, product.id());
                int removed = del.executeUpdate();
                if (removed > 0)
                    log.warn("Replaced stale summary record for product {}", product.name());
                ins.setInt(1, product.id());
                ins.setString(2, product.name());
                ins.executeUpdate();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        }
        return Optional.empty();
    }

    public Optional<ProductSummary> get(String name) throws Exception {
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(select() + "WHERE p.name = ?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Every product with a summary record, by name.
     */
    public List<ProductSummary> list() throws Exception {
        List<ProductSummary> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(select() + "ORDER BY p.name");
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                out.add(mapRow(rs));
        }
        return out;
    }

    /**
     * Stores the product-wide totals computed by a refresh.
     */
    public void updateProductFields(int productId, long datasetCount, Instant earliest, Instant latest,
            Collection<Integer> sourceRefs, Collection<Integer> derivedRefs, JsonNode fixedMetadata,
            Instant lastRefresh) throws Exception {
        String sql = "UPDATE cubedash.product SET dataset_count = ?, time_earliest = ?, time_latest = ?, "
                + "source_product_refs = ?, derived_product_refs = ?, fixed_metadata = ?::jsonb, last_refresh = ? "
                + "WHERE id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, datasetCount);
            setInstant(ps, 2, earliest);
            setInstant(ps, 3, latest);
            ps.setArray(4, c.createArrayOf("int2", sourceRefs.toArray()));
            ps.setArray(5, c.createArrayOf("int2", derivedRefs.toArray()));
            ps.setString(6, fixedMetadata == null ? null : om.writeValueAsString(fixedMetadata));
            setInstant(ps, 7, lastRefresh);
            ps.setInt(8, productId);
            ps.executeUpdate();
        }
    }

    /**
     * Moves {@code last_successful_summary} forward. An older timestamp is ignored.
     *
     * @return whether the row changed
     */
    public boolean updateRefreshTimestamp(int productId, Instant refreshTime) throws Exception {
        String sql = "UPDATE cubedash.product SET last_successful_summary = ? "
                + "WHERE id = ? AND (last_successful_summary IS NULL OR last_successful_summary < ?)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(refreshTime));
            ps.setInt(2, productId);
            ps.setTimestamp(3, Timestamp.from(refreshTime));
            return ps.executeUpdate() > 0;
        }
    }

    /**
     * Records the position the next incremental scan starts from.
     */
    public void updateLastRefresh(int productId, Instant lastRefresh) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("UPDATE cubedash.product SET last_refresh = ? WHERE id = ?")) {
            ps.setTimestamp(1, Timestamp.from(lastRefresh));
            ps.setInt(2, productId);
            ps.executeUpdate();
        }
    }

    /**
     * Clears the incremental position so the next refresh rescans everything.
     */
    public void resetRefreshPosition(int productId) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("UPDATE cubedash.product SET last_refresh = NULL WHERE id = ?")) {
            ps.setInt(1, productId);
            ps.executeUpdate();
        }
    }

    /**
     * Footprint and metadata completeness per product, from the stats view.
     */
    public List<SpatialQuality> spatialQualityStats() throws Exception {
        String sql = "SELECT p.name, q.count, q.missing_footprint, q.footprint_size, q.footprint_stddev, "
                + "q.missing_srid, q.has_file_size, q.has_region "
                + "FROM cubedash.mv_dataset_spatial_quality q "
                + "JOIN cubedash.product p ON p.id = q.dataset_type_ref ORDER BY p.name";
        List<SpatialQuality> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SpatialQuality(rs.getString(1), rs.getLong(2), rs.getLong(3), rs.getLong(4),
                        rs.getDouble(5), rs.getLong(6), rs.getLong(7), rs.getLong(8)));
            }
        }
        return out;
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private String select() {
        return "SELECT p.id, p.name, p.dataset_count, p.time_earliest, p.time_latest, "
                + "ARRAY(SELECT c.name FROM " + t.product() + " c WHERE c.id = ANY(p.source_product_refs) ORDER BY c.name) AS sources, "
                + "ARRAY(SELECT c.name FROM " + t.product() + " c WHERE c.id = ANY(p.derived_product_refs) ORDER BY c.name) AS derived, "
                + "p.fixed_metadata::text AS fixed_metadata, p.last_refresh, p.last_successful_summary "
                + "FROM cubedash.product p ";
    }

    private ProductSummary mapRow(ResultSet rs) throws Exception {
        String fixed = rs.getString("fixed_metadata");
        return new ProductSummary(
                rs.getInt("id"),
                rs.getString("name"),
                rs.getLong("dataset_count"),
                CatalogRepo.toInstant(rs.getTimestamp("time_earliest")),
                CatalogRepo.toInstant(rs.getTimestamp("time_latest")),
                names(rs.getArray("sources")),
                names(rs.getArray("derived")),
                fixed == null ? null : om.readTree(fixed),
                CatalogRepo.toInstant(rs.getTimestamp("last_refresh")),
                CatalogRepo.toInstant(rs.getTimestamp("last_successful_summary")));
    }

    private static List<String> names(Array a) throws SQLException {
        List<String> out = new ArrayList<>();
        if (a == null)
            return out;
        for (Object o : (Object[]) a.getArray())
            out.add(String.valueOf(o));
        return out;
    }

    private static void setInstant(PreparedStatement ps, int idx, Instant t) throws SQLException {
        if (t == null)
            ps.setNull(idx, Types.TIMESTAMP);
        else
            ps.setTimestamp(idx, Timestamp.from(t));
    }
}
