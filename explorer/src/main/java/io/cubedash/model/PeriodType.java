package io.cubedash.model;

import java.util.Locale;

/**
 * Granularity of a stored time summary, and of timeline buckets within one.
 */
public enum PeriodType {
    DAY, MONTH, YEAR, ALL;

    /** Name stored in {@code cubedash.time_overview.period_type}. */
    public String dbName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PeriodType fromDb(String s) {
        return valueOf(s.toUpperCase(Locale.ROOT));
    }

    /** The next coarser timeline bucket; {@code YEAR} is the coarsest. */
    public PeriodType coarser() {
        return switch (this) {
            case DAY -> MONTH;
            case MONTH, YEAR, ALL -> YEAR;
        };
    }
}
