package io.cubedash.summary;

import com.zaxxer.hikari.HikariDataSource;
import io.cubedash.db.SchemaRepo;
import io.cubedash.model.PeriodType;
import io.cubedash.model.TimeRange;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKBReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.*;

/**
 * Calculates the summary of one product over one time range, straight from
 * {@code cubedash.dataset_spatial}.
 *
 * <p>
 * Footprints are unioned per source SRID, transformed to the grouping CRS and
 * then unioned together. Datasets with an invalid footprint are left out
 * entirely. Days are counted in the grouping time zone.
 * </p>
 */
public class Summariser {
    private static final Logger log = LoggerFactory.getLogger(Summariser.class);

    private static final String WHERE = "WHERE s.dataset_type_ref = ? AND s.center_time >= ? AND s.center_time < ? "
            + "AND (s.footprint IS NULL OR ST_IsValid(s.footprint)) ";

    private final HikariDataSource ds;
    private final SchemaRepo schema;
    private final ZoneId zone;
    private final int groupingEpsg;

    public Summariser(HikariDataSource ds, SchemaRepo schema, ZoneId zone, int groupingEpsg) {
        this.ds = ds;
        this.schema = schema;
        this.zone = zone;
        this.groupingEpsg = groupingEpsg;
    }

    public ZoneId zone() {
        return zone;
    }

    public TimePeriodOverview calculate(int productId, TimeRange range) throws Exception {
        long t0 = System.currentTimeMillis();
        String sridSql = "WITH srid_groups AS ("
                + "  SELECT ST_SRID(s.footprint) AS srid, count(*) AS dataset_count, "
                + "  count(s.footprint) AS footprint_count, "
                + "  CASE WHEN ST_SRID(s.footprint) > 0 THEN ST_Transform(ST_Union(s.footprint), ?) END AS footprint, "
                + "  sum(s.size_bytes) AS size_bytes, max(s.creation_time) AS newest "
                + "  FROM cubedash.dataset_spatial s " + WHERE
                + "  GROUP BY ST_SRID(s.footprint)"
                + ") "
                + "SELECT coalesce(sum(dataset_count), 0) AS dataset_count, "
                + "coalesce(sum(footprint_count) FILTER (WHERE footprint IS NOT NULL), 0) AS footprint_count, "
                + "array_agg(srid) FILTER (WHERE srid > 0) AS srids, "
                + "coalesce(sum(size_bytes), 0) AS size_bytes, "
                + "ST_AsBinary(ST_Union(ST_Buffer(footprint, 0))) AS footprint, "
                + "max(newest) AS newest "
                + "FROM srid_groups";
        String daySql = "SELECT (s.center_time AT TIME ZONE ?)::date AS day, count(*) "
                + "FROM cubedash.dataset_spatial s " + WHERE + "GROUP BY day";
        String regionSql = "SELECT s.region_code, count(*) FROM cubedash.dataset_spatial s " + WHERE
                + "GROUP BY s.region_code";

        long datasetCount;
        long footprintCount;
        long sizeBytes;
        Geometry footprint = null;
        Instant newest;
        List<Integer> srids = new ArrayList<>();
        SortedMap<LocalDate, Integer> timeline = Periods.emptyTimeline(range, zone);
        Map<String, Integer> regions = new HashMap<>();

        try (Connection c = ds.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sridSql)) {
                ps.setInt(1, groupingEpsg);
                bindWhere(ps, 2, productId, range);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    datasetCount = rs.getLong("dataset_count");
                    footprintCount = rs.getLong("footprint_count");
                    sizeBytes = rs.getLong("size_bytes");
                    java.sql.Array arr = rs.getArray("srids");
                    if (arr != null) {
                        for (Object o : (Object[]) arr.getArray()) {
                            if (o != null)
                                srids.add(((Number) o).intValue());
                        }
                    }
                    byte[] wkb = rs.getBytes("footprint");
                    if (wkb != null) {
                        footprint = new WKBReader().read(wkb);
                        footprint.setSRID(groupingEpsg);
                    }
                    Timestamp ts = rs.getTimestamp("newest");
                    newest = ts == null ? null : ts.toInstant();
                }
            }

            if (datasetCount > 0) {
                try (PreparedStatement ps = c.prepareStatement(daySql)) {
                    ps.setString(1, zone.getId());
                    bindWhere(ps, 2, productId, range);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next())
                            timeline.merge(rs.getObject(1, LocalDate.class), rs.getInt(2), Integer::sum);
                    }
                }
                try (PreparedStatement ps = c.prepareStatement(regionSql)) {
                    bindWhere(ps, 1, productId, range);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next())
                            regions.put(rs.getString(1), rs.getInt(2));
                    }
                }
            }
        }

        SortedSet<String> crses = new TreeSet<>();
        for (Integer srid : srids) {
            String name = schema.sridName(srid);
            if (name != null)
                crses.add(name);
        }

        if (footprint != null && footprint.isEmpty())
            footprint = null;
        log.debug("calculate product={} range={}..{} -> {} datasets ({} ms)", productId, range.begin(), range.end(),
                datasetCount, System.currentTimeMillis() - t0);

        return new TimePeriodOverview(
                datasetCount,
                timeline,
                PeriodType.DAY,
                regions,
                range,
                footprint,
                footprint == null ? null : groupingEpsg,
                footprint == null ? 0 : footprintCount,
                newest,
                crses,
                Instant.now(),
                sizeBytes,
                null);
    }

    private static void bindWhere(PreparedStatement ps, int from, int productId, TimeRange range) throws Exception {
        ps.setInt(from, productId);
        ps.setTimestamp(from + 1, Timestamp.from(range.begin()));
        ps.setTimestamp(from + 2, Timestamp.from(range.end()));
    }
}
