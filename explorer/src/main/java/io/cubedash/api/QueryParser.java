package io.cubedash.api;

import io.cubedash.model.FieldFilter;
import io.cubedash.model.SearchField;
import io.cubedash.model.TimeRange;

import java.time.*;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Reads query arguments shared by the dataset listing routes.
 *
 * <p>
 * Time arguments accept a date ({@code 2017-10-01}, a whole day in the grouping
 * zone), a local date-time (also in the grouping zone) or an ISO-8601 instant
 * with offset. An end date includes that whole day.
 * </p>
 */
final class QueryParser {
    private QueryParser() {
    }

    /** Year, month and day taken from a path; trailing parts may be null. */
    record PeriodArgs(Integer year, Integer month, Integer day) {
    }

    static PeriodArgs period(String year, String month, String day) {
        Integer y = year == null ? null : intArg("year", year);
        Integer m = month == null ? null : intArg("month", month);
        Integer d = day == null ? null : intArg("day", day);
        if (y != null && (y < 1 || y > 9999))
            throw new BadRequestException("Year out of range: " + y);
        if (m != null && (m < 1 || m > 12))
            throw new BadRequestException("Month out of range: " + m);
        if (d != null) {
            try {
                LocalDate.of(y, m, d);
            } catch (DateTimeException e) {
                throw new BadRequestException("No such day: " + y + "-" + m + "-" + d, e);
            }
        }
        return new PeriodArgs(y, m, d);
    }

    static String first(Map<String, List<String>> params, String key) {
        List<String> v = params.get(key);
        if (v == null || v.isEmpty())
            return null;
        String s = v.get(0);
        return s == null || s.isBlank() ? null : s.trim();
    }

    /**
     * {@code time-begin}/{@code time-end}, or null when neither is given.
     * Reversed bounds are swapped.
     */
    static TimeRange timeRange(Map<String, List<String>> params, ZoneId zone) {
        String b = first(params, "time-begin");
        String e = first(params, "time-end");
        if (b == null && e == null)
            return null;
        Instant begin = b == null ? null : parseTime(b, zone, false);
        Instant end = e == null ? null : parseTime(e, zone, true);
        if (begin != null && end != null && end.isBefore(begin)) {
            return new TimeRange(parseTime(e, zone, false), parseTime(b, zone, true));
        }
        return new TimeRange(begin, end);
    }

    /**
     * @param asEnd when true a plain date means the end of that day
     */
    static Instant parseTime(String s, ZoneId zone, boolean asEnd) {
        String v = s.trim();
        try {
            if (v.length() == 10) {
                LocalDate day = LocalDate.parse(v);
                return (asEnd ? day.plusDays(1) : day).atStartOfDay(zone).toInstant();
            }
            if (v.endsWith("Z") || v.matches(".*[+-]\\d\\d:?\\d\\d$"))
                return OffsetDateTime.parse(v).toInstant();
            return LocalDateTime.parse(v).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            throw new BadRequestException("Unreadable time: " + s, e);
        }
    }

    /**
     * Metadata restrictions: {@code <field>-begin}/{@code <field>-end} for
     * range fields, {@code <field>=value} for plain ones. Unknown arguments are
     * ignored. Reversed numeric and time ranges are swapped.
     */
    static List<FieldFilter> fieldFilters(Map<String, List<String>> params, Map<String, SearchField> fields,
            ZoneId zone) {
        Map<String, String[]> ranges = new TreeMap<>();
        List<FieldFilter> out = new ArrayList<>();
        for (String key : new TreeSet<>(params.keySet())) {
            String value = first(params, key);
            if (value == null)
                continue;
            int bound;
            String name;
            if (key.endsWith("-begin")) {
                bound = 0;
                name = key.substring(0, key.length() - "-begin".length());
            } else if (key.endsWith("-end")) {
                bound = 1;
                name = key.substring(0, key.length() - "-end".length());
            } else {
                SearchField f = fields.get(key);
                if (f != null && !f.isRange())
                    out.add(new FieldFilter(f, normalise(f, value, zone, false), null));
                continue;
            }
            SearchField f = fields.get(name);
            if (name.equals("time") || f == null || !f.isRange())
                continue;
            ranges.computeIfAbsent(name, k -> new String[2])[bound] = value;
        }

        for (Map.Entry<String, String[]> e : ranges.entrySet()) {
            SearchField f = fields.get(e.getKey());
            String begin = e.getValue()[0];
            String end = e.getValue()[1];
            if (begin != null && end != null && reversed(f, begin, end, zone)) {
                String tmp = begin;
                begin = end;
                end = tmp;
            }
            out.add(new FieldFilter(f,
                    begin == null ? null : normalise(f, begin, zone, false),
                    end == null ? null : normalise(f, end, zone, true)));
        }
        return out;
    }

    private static boolean reversed(SearchField f, String begin, String end, ZoneId zone) {
        if (f.isNumeric())
            return number(f, begin) > number(f, end);
        if (f.sqlType().equals("timestamptz"))
            return parseTime(begin, zone, false).isAfter(parseTime(end, zone, true));
        return false;
    }

    private static String normalise(SearchField f, String value, ZoneId zone, boolean asEnd) {
        if (f.isNumeric()) {
            number(f, value);
            return value;
        }
        if (f.sqlType().equals("timestamptz"))
            return parseTime(value, zone, asEnd).toString();
        return value;
    }

    private static double number(SearchField f, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new BadRequestException("Expected a number for " + f.name() + ": " + value, e);
        }
    }

    static Integer intArg(String name, String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new BadRequestException("Expected a whole number for " + name + ": " + value, e);
        }
    }

    /**
     * {@code minLon,minLat,maxLon,maxLat}, or null when blank.
     */
    static double[] bbox(String value) {
        if (value == null || value.isBlank())
            return null;
        String[] parts = value.split(",");
        if (parts.length != 4)
            throw new BadRequestException("bbox needs four comma-separated numbers");
        double[] out = new double[4];
        try {
            for (int i = 0; i < 4; i++)
                out[i] = Double.parseDouble(parts[i].trim());
        } catch (NumberFormatException e) {
            throw new BadRequestException("Unreadable bbox: " + value, e);
        }
        return out;
    }

    static UUID uuid(String value) {
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Not a dataset id: " + value, e);
        }
    }
}
