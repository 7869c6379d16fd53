package io.cubedash.summary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cubedash.model.PeriodType;
import io.cubedash.model.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryJsonTest {
    private final ObjectMapper om = new ObjectMapper();

    @Test
    void overviewListsTheNoRegionBucketFirst() {
        Map<String, Integer> regions = new HashMap<>();
        regions.put("091084", 1);
        regions.put(null, 4);
        regions.put("090084", 2);
        TreeMap<LocalDate, Integer> timeline = new TreeMap<>();
        timeline.put(LocalDate.of(2017, 10, 1), 7);
        TimePeriodOverview s = new TimePeriodOverview(7, timeline, PeriodType.DAY, regions,
                new TimeRange(Instant.parse("2017-09-30T14:30:00Z"), Instant.parse("2017-10-31T14:30:00Z")), null,
                null, 0, null, new TreeSet<>(), null, 0, null);

        JsonNode json = SummaryJson.overview(om, s);

        assertThat(json.path("dataset_count").asLong()).isEqualTo(7);
        assertThat(json.path("timeline_period").asText()).isEqualTo("day");
        assertThat(json.path("timeline").path("2017-10-01").asInt()).isEqualTo(7);
        assertThat(json.path("regions").get(0).path("region_code").isNull()).isTrue();
        assertThat(json.path("regions").get(1).path("region_code").asText()).isEqualTo("090084");
        assertThat(json.path("regions").get(2).path("region_code").asText()).isEqualTo("091084");
        assertThat(json.path("time_range").path("begin").asText()).isEqualTo("2017-09-30T14:30:00Z");
        assertThat(json.path("has_footprint").asBoolean()).isFalse();
        assertThat(json.path("footprint_srid").isNull()).isTrue();
    }
}
