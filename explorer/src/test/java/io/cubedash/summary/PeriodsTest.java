package io.cubedash.summary;

import io.cubedash.model.PeriodType;
import io.cubedash.model.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.SortedMap;

import static org.assertj.core.api.Assertions.assertThat;

class PeriodsTest {
    private static final ZoneId DARWIN = ZoneId.of("Australia/Darwin");

    @Test
    void monthBoundsFollowTheGroupingZone() {
        TimeRange r = Periods.range(DARWIN, 2017, 10, null);

        assertThat(r.begin()).isEqualTo(Instant.parse("2017-09-30T14:30:00Z"));
        assertThat(r.end()).isEqualTo(Instant.parse("2017-10-31T14:30:00Z"));
    }

    @Test
    void dayAndYearBounds() {
        assertThat(Periods.range(DARWIN, 2017, 10, 5))
                .isEqualTo(new TimeRange(Instant.parse("2017-10-04T14:30:00Z"), Instant.parse("2017-10-05T14:30:00Z")));
        assertThat(Periods.range(ZoneId.of("UTC"), 2018, null, null))
                .isEqualTo(new TimeRange(Instant.parse("2018-01-01T00:00:00Z"), Instant.parse("2019-01-01T00:00:00Z")));
    }

    @Test
    void periodTypeFromSelection() {
        assertThat(Periods.typeOf(null, null, null)).isEqualTo(PeriodType.ALL);
        assertThat(Periods.typeOf(2017, null, null)).isEqualTo(PeriodType.YEAR);
        assertThat(Periods.typeOf(2017, 10, null)).isEqualTo(PeriodType.MONTH);
        assertThat(Periods.typeOf(2017, 10, 1)).isEqualTo(PeriodType.DAY);
    }

    @Test
    void emptyTimelineHasEveryLocalDay() {
        SortedMap<LocalDate, Integer> t = Periods.emptyTimeline(Periods.range(DARWIN, 2017, 10, null), DARWIN);

        assertThat(t).hasSize(31);
        assertThat(t.firstKey()).isEqualTo(LocalDate.of(2017, 10, 1));
        assertThat(t.lastKey()).isEqualTo(LocalDate.of(2017, 10, 31));
        assertThat(t.values()).containsOnly(0);
    }

    @Test
    void monthsBetweenUsesLocalMonths() {
        // 2017-09-30T15:00Z is already October in Darwin
        assertThat(Periods.monthsBetween(Instant.parse("2017-09-30T15:00:00Z"), Instant.parse("2018-01-02T00:00:00Z"),
                DARWIN))
                .containsExactly(YearMonth.of(2017, 10), YearMonth.of(2017, 11), YearMonth.of(2017, 12),
                        YearMonth.of(2018, 1));
        assertThat(Periods.monthsBetween(null, null, DARWIN)).isEmpty();
    }

    @Test
    void bucketsTruncate() {
        LocalDate d = LocalDate.of(2017, 10, 17);
        assertThat(Periods.bucket(d, PeriodType.DAY)).isEqualTo(d);
        assertThat(Periods.bucket(d, PeriodType.MONTH)).isEqualTo(LocalDate.of(2017, 10, 1));
        assertThat(Periods.bucket(d, PeriodType.YEAR)).isEqualTo(LocalDate.of(2017, 1, 1));
    }
}
