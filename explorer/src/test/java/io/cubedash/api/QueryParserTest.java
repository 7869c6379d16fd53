package io.cubedash.api;

import io.cubedash.model.FieldFilter;
import io.cubedash.model.SearchField;
import io.cubedash.model.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryParserTest {
    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final ZoneId DARWIN = ZoneId.of("Australia/Darwin");

    private static final SearchField CLOUD = new SearchField("cloud_cover", "double-range", null, null,
            List.of("a"), List.of("b"));
    private static final SearchField PLATFORM = new SearchField("platform", "string", null, List.of("p"), null,
            null);
    private static final SearchField CREATED = new SearchField("creation_time", "datetime-range", null, null,
            List.of("c"), List.of("c"));

    @Test
    void periodValidatesItsParts() {
        assertThat(QueryParser.period(null, null, null)).isEqualTo(new QueryParser.PeriodArgs(null, null, null));
        assertThat(QueryParser.period("2017", "10", "31")).isEqualTo(new QueryParser.PeriodArgs(2017, 10, 31));

        assertThatThrownBy(() -> QueryParser.period("2017", "13", null)).isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> QueryParser.period("2017", "2", "30")).isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> QueryParser.period("twenty", null, null)).isInstanceOf(BadRequestException.class);
    }

    @Test
    void endDateIncludesTheWholeDayInTheGroupingZone() {
        TimeRange r = QueryParser.timeRange(Map.of("time-begin", List.of("2017-10-01"), "time-end",
                List.of("2017-10-01")), DARWIN);

        assertThat(r.begin()).isEqualTo(Instant.parse("2017-09-30T14:30:00Z"));
        assertThat(r.end()).isEqualTo(Instant.parse("2017-10-01T14:30:00Z"));
    }

    @Test
    void reversedTimeBoundsAreSwapped() {
        TimeRange r = QueryParser.timeRange(Map.of("time-begin", List.of("2017-10-05"), "time-end",
                List.of("2017-10-01")), UTC);

        assertThat(r).isEqualTo(new TimeRange(Instant.parse("2017-10-01T00:00:00Z"),
                Instant.parse("2017-10-06T00:00:00Z")));
        assertThat(QueryParser.timeRange(Map.of(), UTC)).isNull();
    }

    @Test
    void timesWithAndWithoutOffsets() {
        assertThat(QueryParser.parseTime("2017-10-01T12:00:00+09:30", UTC, false))
                .isEqualTo(Instant.parse("2017-10-01T02:30:00Z"));
        assertThat(QueryParser.parseTime("2017-10-01T12:00:00", DARWIN, false))
                .isEqualTo(Instant.parse("2017-10-01T02:30:00Z"));
        assertThat(QueryParser.parseTime("2017-10-01T02:30:00Z", DARWIN, true))
                .isEqualTo(Instant.parse("2017-10-01T02:30:00Z"));
        assertThatThrownBy(() -> QueryParser.parseTime("yesterday", UTC, false))
                .isInstanceOf(BadRequestException.class);
    }

    @Test
    void fieldFiltersReadRangesAndPlainValues() {
        Map<String, SearchField> fields = Map.of("cloud_cover", CLOUD, "platform", PLATFORM, "creation_time",
                CREATED);
        Map<String, List<String>> params = Map.of(
                "cloud_cover-begin", List.of("50"),
                "cloud_cover-end", List.of("10"),
                "platform", List.of("landsat-8"),
                "sensor", List.of("ignored"),
                "time-begin", List.of("2017-01-01"),
                "creation_time-end", List.of("2018-01-01"));

        List<FieldFilter> filters = QueryParser.fieldFilters(params, fields, UTC);

        assertThat(filters).containsExactlyInAnyOrder(
                new FieldFilter(PLATFORM, "landsat-8", null),
                new FieldFilter(CLOUD, "10", "50"),
                new FieldFilter(CREATED, null, "2018-01-02T00:00:00Z"));
    }

    @Test
    void numericFiltersMustBeNumbers() {
        assertThatThrownBy(() -> QueryParser.fieldFilters(Map.of("cloud_cover-begin", List.of("lots")),
                Map.of("cloud_cover", CLOUD), UTC))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("cloud_cover");
    }

    @Test
    void bboxAndUuid() {
        assertThat(QueryParser.bbox("130, -13, 131,-12")).containsExactly(130, -13, 131, -12);
        assertThat(QueryParser.bbox(" ")).isNull();
        assertThatThrownBy(() -> QueryParser.bbox("1,2,3")).isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> QueryParser.uuid("not-a-uuid")).isInstanceOf(BadRequestException.class);
    }

    @Test
    void lenientIntegersAreClamped() {
        assertThat(ApiServer.parseInt(null, 14, 1, 365)).isEqualTo(14);
        assertThat(ApiServer.parseInt("abc", 14, 1, 365)).isEqualTo(14);
        assertThat(ApiServer.parseInt("9999", 14, 1, 365)).isEqualTo(365);
        assertThat(ApiServer.parseInt("-3", 14, 1, 365)).isEqualTo(1);
    }
}
