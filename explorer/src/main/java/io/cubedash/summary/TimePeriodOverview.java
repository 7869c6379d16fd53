package io.cubedash.summary;

import io.cubedash.model.PeriodType;
import io.cubedash.model.TimeRange;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.union.UnaryUnionOp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.*;

/**
 * Aggregate of a product's datasets over one time period.
 *
 * <p>
 * The footprint is held in the grouping CRS ({@code footprintSrid}); it is only
 * reprojected to EPSG:4326 when served. Region counts use a null key for
 * datasets without a region.
 * </p>
 */
public record TimePeriodOverview(
        long datasetCount,
        SortedMap<LocalDate, Integer> timelineDatasetCounts,
        PeriodType timelinePeriod,
        Map<String, Integer> regionDatasetCounts,
        TimeRange timeRange,
        Geometry footprintGeometry,
        Integer footprintSrid,
        long footprintCount,
        Instant newestDatasetCreationTime,
        SortedSet<String> crses,
        Instant summaryGenTime,
        long sizeBytes,
        Instant productRefreshTime) {

    /**
     * A summary of nothing.
     */
    public static TimePeriodOverview empty() {
        return new TimePeriodOverview(0, new TreeMap<>(), PeriodType.DAY, new HashMap<>(), null, null, null, 0,
                null, new TreeSet<>(), null, 0, null);
    }

    public boolean hasFootprint() {
        return footprintGeometry != null && !footprintGeometry.isEmpty();
    }

    /**
     * Copy stamped with the product refresh that produced it.
     */
    public TimePeriodOverview withProductRefreshTime(Instant t) {
        return new TimePeriodOverview(datasetCount, timelineDatasetCounts, timelinePeriod, regionDatasetCounts,
                timeRange, footprintGeometry, footprintSrid, footprintCount, newestDatasetCreationTime, crses,
                summaryGenTime, sizeBytes, t);
    }

    /**
     * Combines child periods (eg. the months of a year) into one overview.
     *
     * <p>
     * Null and empty periods are ignored. Timelines are summed and regrouped
     * into coarser buckets while they exceed {@link Periods#MAX_TIMELINE_BUCKETS}.
     * Only valid, non-empty footprints contribute to the union and to
     * {@code footprintCount}.
     * </p>
     *
     * @throws IllegalStateException if the periods' footprints use different CRSes
     */
    public static TimePeriodOverview combine(Collection<TimePeriodOverview> periods) {
        List<TimePeriodOverview> ps = new ArrayList<>();
        for (TimePeriodOverview p : periods) {
            if (p != null && p.datasetCount() > 0)
                ps.add(p);
        }
        if (ps.isEmpty())
            return empty();

        Set<Integer> srids = new TreeSet<>();
        for (TimePeriodOverview p : ps) {
            if (p.footprintSrid() != null)
                srids.add(p.footprintSrid());
        }
        if (srids.size() > 1) {
            throw new IllegalStateException("Time summaries use inconsistent CRSes: " + srids);
        }
        Integer srid = srids.isEmpty() ? null : srids.iterator().next();

        PeriodType period = PeriodType.DAY;
        for (TimePeriodOverview p : ps) {
            if (p.timelinePeriod().ordinal() > period.ordinal())
                period = p.timelinePeriod();
        }
        SortedMap<LocalDate, Integer> timeline = new TreeMap<>();
        for (TimePeriodOverview p : ps) {
            for (var e : p.timelineDatasetCounts().entrySet()) {
                timeline.merge(Periods.bucket(e.getKey(), period), e.getValue(), Integer::sum);
            }
        }
        while (timeline.size() > Periods.MAX_TIMELINE_BUCKETS && period != PeriodType.YEAR) {
            period = period.coarser();
            timeline = regroup(timeline, period);
        }

        Map<String, Integer> regions = new HashMap<>();
        long datasetCount = 0;
        long sizeBytes = 0;
        Instant begin = null;
        Instant end = null;
        Instant newest = null;
        Instant genTime = null;
        Instant refreshTime = null;
        SortedSet<String> crses = new TreeSet<>();
        List<Geometry> footprints = new ArrayList<>();
        long footprintCount = 0;

        for (TimePeriodOverview p : ps) {
            datasetCount += p.datasetCount();
            sizeBytes += p.sizeBytes();
            p.regionDatasetCounts().forEach((k, v) -> regions.merge(k, v, Integer::sum));
            crses.addAll(p.crses());
            if (p.timeRange() != null) {
                begin = min(begin, p.timeRange().begin());
                end = max(end, p.timeRange().end());
            }
            newest = max(newest, p.newestDatasetCreationTime());
            genTime = min(genTime, p.summaryGenTime());
            refreshTime = max(refreshTime, p.productRefreshTime());

            Geometry g = p.footprintGeometry();
            if (p.footprintCount() > 0 && g != null && !g.isEmpty() && g.isValid()) {
                footprints.add(g);
                footprintCount += p.footprintCount();
            }
        }

        Geometry union = null;
        if (!footprints.isEmpty()) {
            union = UnaryUnionOp.union(footprints);
            if (srid != null)
                union.setSRID(srid);
        }

        return new TimePeriodOverview(
                datasetCount,
                timeline,
                period,
                regions,
                (begin == null && end == null) ? null : new TimeRange(begin, end),
                union,
                srid,
                footprintCount,
                newest,
                crses,
                genTime,
                sizeBytes,
                refreshTime);
    }

    private static SortedMap<LocalDate, Integer> regroup(SortedMap<LocalDate, Integer> timeline, PeriodType period) {
        SortedMap<LocalDate, Integer> out = new TreeMap<>();
        timeline.forEach((day, count) -> out.merge(Periods.bucket(day, period), count, Integer::sum));
        return out;
    }

    private static Instant min(Instant a, Instant b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return a.isBefore(b) ? a : b;
    }

    private static Instant max(Instant a, Instant b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return a.isAfter(b) ? a : b;
    }
}
