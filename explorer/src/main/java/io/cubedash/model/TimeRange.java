package io.cubedash.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A half-open time range {@code [begin, end)}. Either bound may be null when open.
 */
public record TimeRange(Instant begin, Instant end) {

    public TimeRange {
        if (begin != null && end != null && end.isBefore(begin)) {
            throw new IllegalArgumentException("Range end " + end + " is before begin " + begin);
        }
    }

    public boolean contains(Instant t) {
        Objects.requireNonNull(t, "t");
        return (begin == null || !t.isBefore(begin)) && (end == null || t.isBefore(end));
    }

    public boolean isBounded() {
        return begin != null && end != null;
    }
}
