package io.cubedash.db;

import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.model.PeriodType;
import io.cubedash.model.TimeRange;
import io.cubedash.summary.TimePeriodOverview;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKBReader;
import org.locationtech.jts.io.WKBWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

/**
 * Stored period summaries ({@code cubedash.time_overview}).
 */
public class TimeOverviewRepo {
    private static final Logger log = LoggerFactory.getLogger(TimeOverviewRepo.class);

    private final HikariDataSource ds;

    public TimeOverviewRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /** Dataset count of one stored period, for audit listings. */
    public record PeriodCount(String productName, LocalDate startDay, PeriodType period, long datasetCount) {
    }

    /**
     * Inserts or replaces the summary of one period. {@code generation_time} is
     * the write time, so a year written after its months is never outdated.
     */
    public void put(int productId, LocalDate startDay, PeriodType period, TimePeriodOverview s) throws Exception {
        String sql = "INSERT INTO cubedash.time_overview (product_ref, start_day, period_type, dataset_count, "
                + "time_earliest, time_latest, timeline_period, timeline_dataset_start_days, timeline_dataset_counts, "
                + "regions, region_dataset_counts, newest_dataset_creation_time, crses, size_bytes, "
                + "footprint_geometry, footprint_count, generation_time, product_refresh_time) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?::date[], ?, ?, ?, ?, ?, ?, ST_SetSRID(ST_GeomFromWKB(?), ?), ?, "
                + "now(), ?) "
                + "ON CONFLICT (product_ref, start_day, period_type) DO UPDATE SET "
                + "dataset_count = EXCLUDED.dataset_count, "
                + "time_earliest = EXCLUDED.time_earliest, "
                + "time_latest = EXCLUDED.time_latest, "
                + "timeline_period = EXCLUDED.timeline_period, "
                + "timeline_dataset_start_days = EXCLUDED.timeline_dataset_start_days, "
                + "timeline_dataset_counts = EXCLUDED.timeline_dataset_counts, "
                + "regions = EXCLUDED.regions, "
                + "region_dataset_counts = EXCLUDED.region_dataset_counts, "
                + "newest_dataset_creation_time = EXCLUDED.newest_dataset_creation_time, "
                + "crses = EXCLUDED.crses, "
                + "size_bytes = EXCLUDED.size_bytes, "
                + "footprint_geometry = EXCLUDED.footprint_geometry, "
                + "footprint_count = EXCLUDED.footprint_count, "
                + "generation_time = EXCLUDED.generation_time, "
                + "product_refresh_time = EXCLUDED.product_refresh_time";

        String[] days = new String[s.timelineDatasetCounts().size()];
        Integer[] dayCounts = new Integer[days.length];
        int i = 0;
        for (var e : s.timelineDatasetCounts().entrySet()) {
            days[i] = e.getKey().toString();
            dayCounts[i] = e.getValue();
            i++;
        }
        String[] regions = new String[s.regionDatasetCounts().size()];
        Integer[] regionCounts = new Integer[regions.length];
        i = 0;
        for (var e : s.regionDatasetCounts().entrySet()) {
            regions[i] = e.getKey();
            regionCounts[i] = e.getValue();
            i++;
        }

        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            ps.setObject(2, startDay);
            ps.setString(3, period.dbName());
            ps.setLong(4, s.datasetCount());
            setInstant(ps, 5, s.timeRange() == null ? null : s.timeRange().begin());
            setInstant(ps, 6, s.timeRange() == null ? null : s.timeRange().end());
            ps.setString(7, s.timelinePeriod().dbName());
            ps.setArray(8, c.createArrayOf("text", days));
            ps.setArray(9, c.createArrayOf("int4", dayCounts));
            ps.setArray(10, c.createArrayOf("text", regions));
            ps.setArray(11, c.createArrayOf("int4", regionCounts));
            setInstant(ps, 12, s.newestDatasetCreationTime());
            ps.setArray(13, c.createArrayOf("text", s.crses().toArray(new String[0])));
            ps.setLong(14, s.sizeBytes());
            if (s.hasFootprint()) {
                ps.setBytes(15, new WKBWriter().write(s.footprintGeometry()));
                ps.setInt(16, s.footprintSrid() == null ? 0 : s.footprintSrid());
            } else {
                ps.setNull(15, Types.BINARY);
                ps.setNull(16, Types.INTEGER);
            }
            ps.setLong(17, s.footprintCount());
            setInstant(ps, 18, s.productRefreshTime());
            ps.executeUpdate();
        }
        log.debug("put time_overview product={} {} {} count={}", productId, period.dbName(), startDay,
                s.datasetCount());
    }

    public Optional<TimePeriodOverview> get(int productId, LocalDate startDay, PeriodType period) throws Exception {
        String sql = "SELECT dataset_count, time_earliest, time_latest, timeline_period, "
                + "timeline_dataset_start_days, timeline_dataset_counts, regions, region_dataset_counts, "
                + "newest_dataset_creation_time, crses, size_bytes, ST_AsBinary(footprint_geometry) AS fp_wkb, "
                + "ST_SRID(footprint_geometry) AS fp_srid, footprint_count, generation_time, product_refresh_time "
                + "FROM cubedash.time_overview WHERE product_ref = ? AND start_day = ? AND period_type = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            ps.setObject(2, startDay);
            ps.setString(3, period.dbName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Start days of every stored period of the given type.
     */
    public SortedSet<LocalDate> alreadySummarised(int productId, PeriodType period) throws Exception {
        String sql = "SELECT start_day FROM cubedash.time_overview WHERE product_ref = ? AND period_type = ?";
        SortedSet<LocalDate> out = new TreeSet<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            ps.setString(2, period.dbName());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(rs.getObject(1, LocalDate.class));
            }
        }
        return out;
    }

    /**
     * Years whose summary is older than one of their months' summaries.
     */
    public List<LocalDate> outdatedYears(int productId) throws Exception {
        String sql = "SELECT y.start_day FROM cubedash.time_overview y "
                + "WHERE y.product_ref = ? AND y.period_type = 'year' AND EXISTS ("
                + "  SELECT 1 FROM cubedash.time_overview m "
                + "  WHERE m.product_ref = y.product_ref AND m.period_type = 'month' "
                + "  AND extract(year FROM m.start_day) = extract(year FROM y.start_day) "
                + "  AND m.generation_time > y.generation_time) "
                + "ORDER BY y.start_day";
        List<LocalDate> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, productId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(rs.getObject(1, LocalDate.class));
            }
        }
        return out;
    }

    /**
     * Dataset counts of every stored period of every product.
     */
    public List<PeriodCount> datasetCountsPerPeriod() throws Exception {
        String sql = "SELECT p.name, t.start_day, t.period_type, t.dataset_count "
                + "FROM cubedash.time_overview t JOIN cubedash.product p ON p.id = t.product_ref "
                + "ORDER BY p.name, t.start_day, t.period_type";
        List<PeriodCount> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new PeriodCount(rs.getString(1), rs.getObject(2, LocalDate.class),
                        PeriodType.fromDb(rs.getString(3)), rs.getLong(4)));
            }
        }
        return out;
    }

    public int deleteProduct(int productId) throws Exception {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("DELETE FROM cubedash.time_overview WHERE product_ref = ?")) {
            ps.setInt(1, productId);
            return ps.executeUpdate();
        }
    }

    // ----------------------------
    // helpers
    // ----------------------------
    private static TimePeriodOverview mapRow(ResultSet rs) throws Exception {
        SortedMap<LocalDate, Integer> timeline = new TreeMap<>();
        Object[] days = arrayOf(rs.getArray("timeline_dataset_start_days"));
        Object[] dayCounts = arrayOf(rs.getArray("timeline_dataset_counts"));
        for (int i = 0; i < days.length && i < dayCounts.length; i++) {
            timeline.put(toLocalDate(days[i]), ((Number) dayCounts[i]).intValue());
        }

        Map<String, Integer> regions = new HashMap<>();
        Object[] regionCodes = arrayOf(rs.getArray("regions"));
        Object[] regionCounts = arrayOf(rs.getArray("region_dataset_counts"));
        for (int i = 0; i < regionCodes.length && i < regionCounts.length; i++) {
            regions.put((String) regionCodes[i], ((Number) regionCounts[i]).intValue());
        }

        SortedSet<String> crses = new TreeSet<>();
        for (Object o : arrayOf(rs.getArray("crses"))) {
            if (o != null)
                crses.add(o.toString());
        }

        Geometry footprint = null;
        Integer srid = null;
        byte[] wkb = rs.getBytes("fp_wkb");
        if (wkb != null) {
            footprint = new WKBReader().read(wkb);
            srid = rs.getInt("fp_srid");
            footprint.setSRID(srid);
        }

        Instant begin = CatalogRepo.toInstant(rs.getTimestamp("time_earliest"));
        Instant end = CatalogRepo.toInstant(rs.getTimestamp("time_latest"));
        return new TimePeriodOverview(
                rs.getLong("dataset_count"),
                timeline,
                PeriodType.fromDb(rs.getString("timeline_period")),
                regions,
                (begin == null && end == null) ? null : new TimeRange(begin, end),
                footprint,
                srid,
                rs.getLong("footprint_count"),
                CatalogRepo.toInstant(rs.getTimestamp("newest_dataset_creation_time")),
                crses,
                CatalogRepo.toInstant(rs.getTimestamp("generation_time")),
                rs.getLong("size_bytes"),
                CatalogRepo.toInstant(rs.getTimestamp("product_refresh_time")));
    }

    private static Object[] arrayOf(Array a) throws SQLException {
        return a == null ? new Object[0] : (Object[]) a.getArray();
    }

    private static LocalDate toLocalDate(Object o) {
        if (o instanceof java.sql.Date d)
            return d.toLocalDate();
        if (o instanceof LocalDate d)
            return d;
        return LocalDate.parse(o.toString());
    }

    private static void setInstant(PreparedStatement ps, int idx, Instant t) throws SQLException {
        if (t == null)
            ps.setNull(idx, Types.TIMESTAMP);
        else
            ps.setTimestamp(idx, Timestamp.from(t));
    }
}
