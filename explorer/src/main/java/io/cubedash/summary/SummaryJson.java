package io.cubedash.summary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.model.ProductSummary;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON views of summaries, shared by the HTTP API and {@code cubedash-view}.
 */
public final class SummaryJson {
    private SummaryJson() {
    }

    public static ObjectNode overview(ObjectMapper om, TimePeriodOverview s) {
        ObjectNode out = om.createObjectNode();
        out.put("dataset_count", s.datasetCount());
        out.put("timeline_period", s.timelinePeriod().dbName());
        ObjectNode timeline = out.putObject("timeline");
        s.timelineDatasetCounts().forEach((day, count) -> timeline.put(day.toString(), count));

        // null region sorts first as "no region"
        ArrayNode regions = out.putArray("regions");
        Map<String, Integer> sorted = new TreeMap<>((a, b) -> a == null ? (b == null ? 0 : -1)
                : b == null ? 1 : a.compareTo(b));
        sorted.putAll(s.regionDatasetCounts());
        sorted.forEach((code, count) -> {
            ObjectNode r = regions.addObject();
            r.put("region_code", code);
            r.put("count", count);
        });

        ObjectNode range = out.putObject("time_range");
        put(range, "begin", s.timeRange() == null ? null : s.timeRange().begin());
        put(range, "end", s.timeRange() == null ? null : s.timeRange().end());
        out.put("footprint_count", s.footprintCount());
        out.put("has_footprint", s.hasFootprint());
        if (s.footprintSrid() == null)
            out.putNull("footprint_srid");
        else
            out.put("footprint_srid", s.footprintSrid());
        put(out, "newest_dataset_creation_time", s.newestDatasetCreationTime());
        ArrayNode crses = out.putArray("crses");
        s.crses().forEach(crses::add);
        out.put("size_bytes", s.sizeBytes());
        put(out, "summary_gen_time", s.summaryGenTime());
        put(out, "product_refresh_time", s.productRefreshTime());
        return out;
    }

    public static ObjectNode product(ObjectMapper om, ProductSummary p) {
        ObjectNode out = om.createObjectNode();
        out.put("name", p.name());
        out.put("dataset_count", p.datasetCount());
        put(out, "time_earliest", p.timeEarliest());
        put(out, "time_latest", p.timeLatest());
        ArrayNode sources = out.putArray("source_products");
        p.sourceProducts().forEach(sources::add);
        ArrayNode derived = out.putArray("derived_products");
        p.derivedProducts().forEach(derived::add);
        out.set("fixed_metadata", p.fixedMetadata());
        put(out, "last_refresh_time", p.lastRefreshTime());
        put(out, "last_successful_summary_time", p.lastSuccessfulSummaryTime());
        return out;
    }

    static void put(ObjectNode node, String key, Instant t) {
        if (t == null)
            node.putNull(key);
        else
            node.put(key, t.toString());
    }
}
