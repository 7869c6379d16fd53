package io.cubedash.summary;

import io.cubedash.model.PeriodType;
import io.cubedash.model.TimeRange;

import java.time.*;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Calendar arithmetic for summary periods, done in the grouping time zone.
 */
public final class Periods {
    /** {@code start_day} used for the whole-product ({@code all}) summary row. */
    public static final LocalDate ALL_START_DAY = LocalDate.of(1900, 1, 1);

    /** Timelines longer than this are regrouped into coarser buckets. */
    public static final int MAX_TIMELINE_BUCKETS = 366;

    private Periods() {
    }

    /**
     * Returns the period type addressed by a (year, month, day) selection.
     */
    public static PeriodType typeOf(Integer year, Integer month, Integer day) {
        if (year == null)
            return PeriodType.ALL;
        if (month == null)
            return PeriodType.YEAR;
        if (day == null)
            return PeriodType.MONTH;
        return PeriodType.DAY;
    }

    /**
     * Half-open instant range of a year, month or day in the given zone.
     */
    public static TimeRange range(ZoneId zone, int year, Integer month, Integer day) {
        LocalDate start;
        LocalDate end;
        if (month == null) {
            start = LocalDate.of(year, 1, 1);
            end = start.plusYears(1);
        } else if (day == null) {
            start = LocalDate.of(year, month, 1);
            end = start.plusMonths(1);
        } else {
            start = LocalDate.of(year, month, day);
            end = start.plusDays(1);
        }
        return new TimeRange(start.atStartOfDay(zone).toInstant(), end.atStartOfDay(zone).toInstant());
    }

    public static TimeRange monthRange(ZoneId zone, YearMonth month) {
        return range(zone, month.getYear(), month.getMonthValue(), null);
    }

    /**
     * A timeline with a zero bucket for every local day in the range.
     */
    public static SortedMap<LocalDate, Integer> emptyTimeline(TimeRange range, ZoneId zone) {
        SortedMap<LocalDate, Integer> out = new TreeMap<>();
        if (range == null || !range.isBounded())
            return out;
        LocalDate day = range.begin().atZone(zone).toLocalDate();
        LocalDate last = range.end().atZone(zone).toLocalDate();
        while (day.isBefore(last)) {
            out.put(day, 0);
            day = day.plusDays(1);
        }
        return out;
    }

    /**
     * Every month touched by {@code [earliest, latest]} in the zone, oldest first.
     */
    public static List<YearMonth> monthsBetween(Instant earliest, Instant latest, ZoneId zone) {
        List<YearMonth> out = new ArrayList<>();
        if (earliest == null || latest == null)
            return out;
        YearMonth m = YearMonth.from(earliest.atZone(zone));
        YearMonth last = YearMonth.from(latest.atZone(zone));
        while (!m.isAfter(last)) {
            out.add(m);
            m = m.plusMonths(1);
        }
        return out;
    }

    /**
     * Truncates a timeline key to the bucket of a coarser period.
     */
    public static LocalDate bucket(LocalDate day, PeriodType period) {
        return switch (period) {
            case DAY -> day;
            case MONTH -> day.withDayOfMonth(1);
            case YEAR, ALL -> day.withDayOfYear(1);
        };
    }
}
