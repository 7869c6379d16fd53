package io.cubedash.db;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.model.RegionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-region footprints and counts of each product ({@code cubedash.region}).
 * Datasets without a region are kept under the empty region code.
 */
public class RegionRepo {
    private static final Logger log = LoggerFactory.getLogger(RegionRepo.class);

    private final HikariDataSource ds;
    private final ObjectMapper om;

    public RegionRepo(HikariDataSource ds, ObjectMapper om) {
        this.ds = ds;
        this.om = om;
    }

    /**
     * Recomputes every region of a product from its spatial rows.
     *
     * @return regions written
     */
    public int upsertProductRegions(int productId) throws Exception {
        String sql = "WITH srid_groups AS ("
                + "  SELECT s.region_code, ST_Transform(ST_Union(s.footprint), 4326) AS footprint, count(*) AS n "
                + "  FROM cubedash.dataset_spatial s "
                + "  WHERE s.dataset_type_ref = ? AND ST_SRID(s.footprint) > 0 AND ST_IsValid(s.footprint) "
                + "  GROUP BY s.region_code, ST_SRID(s.footprint)"
                + ") "
                + "INSERT INTO cubedash.region (dataset_type_ref, region_code, footprint, count) "
                + "SELECT ?, coalesce(g.region_code, ''), "
                + "ST_SimplifyPreserveTopology(ST_Union(ST_Buffer(g.footprint, 0)), 0.0001), sum(g.n) "
                + "FROM srid_groups g GROUP BY coalesce(g.region_code, '') "
                + "ON CONFLICT (dataset_type_ref, region_code) DO UPDATE SET "
                + "count = EXCLUDED.count, generation_time = now(), footprint = EXCLUDED.footprint";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            ps.setInt(2, productId);
            int n = ps.executeUpdate();
            log.debug("upsertProductRegions product={} -> {}", productId, n);
            return n;
        }
    }

    /**
     * Removes regions that no longer have any datasets.
     */
    public int deleteEmptyRegions(int productId) throws Exception {
        String sql = "DELETE FROM cubedash.region r WHERE r.dataset_type_ref = ? AND NOT EXISTS ("
                + "SELECT 1 FROM cubedash.dataset_spatial s WHERE s.dataset_type_ref = r.dataset_type_ref "
                + "AND coalesce(s.region_code, '') = r.region_code AND ST_SRID(s.footprint) > 0)";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            return ps.executeUpdate();
        }
    }

    /**
     * A product's regions, by code, with simplified EPSG:4326 footprints.
     */
    public List<RegionSummary> productRegions(int productId) throws Exception {
        String sql = "SELECT region_code, count, generation_time, ST_AsGeoJSON(footprint, 6) AS geom "
                + "FROM cubedash.region WHERE dataset_type_ref = ? ORDER BY region_code";
        List<RegionSummary> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String geo = rs.getString("geom");
                    out.add(new RegionSummary(rs.getString("region_code"), rs.getLong("count"),
                            CatalogRepo.toInstant(rs.getTimestamp("generation_time")),
                            geo == null ? null : om.readTree(geo)));
                }
            }
        }
        return out;
    }
}
