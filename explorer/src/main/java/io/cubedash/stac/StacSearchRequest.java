package io.cubedash.stac;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.cubedash.api.BadRequestException;
import io.cubedash.model.DatasetQuery;
import io.cubedash.model.TimeRange;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * A STAC item search, from query arguments or a POSTed JSON body.
 *
 * @param datetime the raw {@code datetime} argument, kept for paging links
 */
public record StacSearchRequest(
        List<String> collections,
        List<UUID> ids,
        double[] bbox,
        String datetime,
        int limit,
        int offset) {

    public StacSearchRequest {
        collections = collections == null ? List.of() : List.copyOf(collections);
        ids = ids == null ? List.of() : List.copyOf(ids);
    }

    /**
     * From GET arguments: comma-separated {@code collections}, {@code ids} and
     * {@code bbox}; {@code datetime}; {@code limit}; {@code offset}.
     */
    public static StacSearchRequest fromQuery(Map<String, List<String>> params, int defaultLimit, int hardLimit) {
        return new StacSearchRequest(
                splitList(first(params, "collections")),
                uuids(splitList(first(params, "ids"))),
                bbox(splitList(first(params, "bbox"))),
                first(params, "datetime"),
                limit(first(params, "limit"), defaultLimit, hardLimit),
                offset(first(params, "offset")));
    }

    /**
     * From a POST body. Arrays and comma-separated strings are both accepted.
     */
    public static StacSearchRequest fromJson(JsonNode body, int defaultLimit, int hardLimit) {
        if (body == null || body.isNull() || body.isMissingNode())
            return fromQuery(Map.of(), defaultLimit, hardLimit);
        if (!body.isObject())
            throw new BadRequestException("Search body must be a JSON object");
        List<Double> box = new ArrayList<>();
        JsonNode b = body.path("bbox");
        if (b.isArray()) {
            for (JsonNode n : b) {
                if (!n.isNumber())
                    throw new BadRequestException("bbox values must be numbers");
                box.add(n.asDouble());
            }
        } else if (b.isTextual()) {
            splitList(b.asText()).forEach(s -> box.add(parseDouble(s)));
        }
        return new StacSearchRequest(
                strings(body.path("collections")),
                uuids(strings(body.path("ids"))),
                box.isEmpty() ? null : bbox(box),
                text(body.path("datetime")),
                limit(text(body.path("limit")), defaultLimit, hardLimit),
                offset(text(body.path("offset"))));
    }

    /**
     * Restricted to one collection, for the per-collection item listing.
     */
    public StacSearchRequest withCollection(String collection) {
        return new StacSearchRequest(List.of(collection), ids, bbox, datetime, limit, offset);
    }

    public TimeRange timeRange() {
        return parseDatetime(datetime);
    }

    public DatasetQuery toDatasetQuery(boolean includeDocs) {
        return new DatasetQuery(collections, ids, bbox, timeRange(), List.of(), limit, offset, includeDocs);
    }

    /**
     * Query string (without {@code ?}) that repeats this search at another offset.
     */
    public String toQueryString(int atOffset) {
        StringJoiner q = new StringJoiner("&");
        if (!collections.isEmpty())
            q.add("collections=" + encode(String.join(",", collections)));
        if (!ids.isEmpty()) {
            StringJoiner s = new StringJoiner(",");
            ids.forEach(id -> s.add(id.toString()));
            q.add("ids=" + encode(s.toString()));
        }
        if (bbox != null)
            q.add("bbox=" + encode(bbox[0] + "," + bbox[1] + "," + bbox[2] + "," + bbox[3]));
        if (datetime != null)
            q.add("datetime=" + encode(datetime));
        q.add("limit=" + limit);
        q.add("offset=" + atOffset);
        return q.toString();
    }

    /**
     * JSON body that repeats this search at another offset.
     */
    public ObjectNode toJson(ObjectMapper om, int atOffset) {
        ObjectNode out = om.createObjectNode();
        if (!collections.isEmpty()) {
            ArrayNode c = out.putArray("collections");
            collections.forEach(c::add);
        }
        if (!ids.isEmpty()) {
            ArrayNode i = out.putArray("ids");
            ids.forEach(id -> i.add(id.toString()));
        }
        if (bbox != null) {
            ArrayNode b = out.putArray("bbox");
            for (double v : bbox)
                b.add(v);
        }
        if (datetime != null)
            out.put("datetime", datetime);
        out.put("limit", limit);
        out.put("offset", atOffset);
        return out;
    }

    // ----------------------------
    // helpers
    // ----------------------------

    /**
     * A single RFC 3339 instant, or an interval {@code a/b} where either side may be
     * {@code ..} or empty. A plain date means that whole UTC day.
     */
    static TimeRange parseDatetime(String value) {
        if (value == null || value.isBlank())
            return null;
        String v = value.trim();
        int slash = v.indexOf('/');
        if (slash < 0) {
            if (v.length() == 10) {
                LocalDate day = parseDate(v);
                return new TimeRange(day.atStartOfDay(ZoneOffset.UTC).toInstant(),
                        day.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant());
            }
            Instant t = parseInstant(v);
            return new TimeRange(t, t.plus(1, ChronoUnit.MICROS));
        }
        String a = v.substring(0, slash).trim();
        String b = v.substring(slash + 1).trim();
        Instant begin = open(a) ? null : boundary(a, false);
        Instant end = open(b) ? null : boundary(b, true);
        if (begin != null && end != null && end.isBefore(begin))
            throw new BadRequestException("datetime interval ends before it starts: " + value);
        return new TimeRange(begin, end);
    }

    private static boolean open(String s) {
        return s.isEmpty() || s.equals("..");
    }

    private static Instant boundary(String s, boolean asEnd) {
        if (s.length() == 10) {
            LocalDate day = parseDate(s);
            return (asEnd ? day.plusDays(1) : day).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        Instant t = parseInstant(s);
        return asEnd ? t.plus(1, ChronoUnit.MICROS) : t;
    }

    private static LocalDate parseDate(String s) {
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            throw new BadRequestException("Unreadable date: " + s, e);
        }
    }

    private static Instant parseInstant(String s) {
        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            throw new BadRequestException("Unreadable datetime (expected RFC 3339): " + s, e);
        }
    }

    static int limit(String value, int def, int hardLimit) {
        if (value == null || value.isBlank())
            return def;
        int v = parseInt("limit", value);
        if (v < 1)
            throw new BadRequestException("limit must be at least 1");
        if (v > hardLimit)
            throw new BadRequestException("Max page size is " + hardLimit + " (requested " + v + ")");
        return v;
    }

    static int offset(String value) {
        if (value == null || value.isBlank())
            return 0;
        int v = parseInt("offset", value);
        if (v < 0)
            throw new BadRequestException("offset must not be negative");
        return v;
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new BadRequestException("Expected a whole number for " + name + ": " + value, e);
        }
    }

    private static double parseDouble(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new BadRequestException("Unreadable bbox value: " + value, e);
        }
    }

    private static double[] bbox(List<?> parts) {
        if (parts.isEmpty())
            return null;
        if (parts.size() != 4)
            throw new BadRequestException("bbox needs four values (minLon, minLat, maxLon, maxLat)");
        double[] out = new double[4];
        for (int i = 0; i < 4; i++) {
            Object p = parts.get(i);
            out[i] = p instanceof Number n ? n.doubleValue() : parseDouble(String.valueOf(p));
        }
        return out;
    }

    private static List<UUID> uuids(List<String> values) {
        List<UUID> out = new ArrayList<>();
        for (String s : values) {
            try {
                out.add(UUID.fromString(s));
            } catch (IllegalArgumentException e) {
                throw new BadRequestException("Not a dataset id: " + s, e);
            }
        }
        return out;
    }

    private static List<String> strings(JsonNode node) {
        if (node.isArray()) {
            List<String> out = new ArrayList<>();
            node.forEach(n -> {
                if (!n.asText().isBlank())
                    out.add(n.asText().trim());
            });
            return out;
        }
        return node.isTextual() ? splitList(node.asText()) : List.of();
    }

    private static String text(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }

    private static List<String> splitList(String value) {
        if (value == null || value.isBlank())
            return List.of();
        List<String> out = new ArrayList<>();
        for (String s : value.split(",")) {
            if (!s.isBlank())
                out.add(s.trim());
        }
        return out;
    }

    private static String first(Map<String, List<String>> params, String key) {
        List<String> v = params.get(key);
        return v == null || v.isEmpty() ? null : v.get(0);
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StacSearchRequest r && collections.equals(r.collections) && ids.equals(r.ids)
                && Arrays.equals(bbox, r.bbox) && Objects.equals(datetime, r.datetime) && limit == r.limit
                && offset == r.offset;
    }

    @Override
    public int hashCode() {
        return Objects.hash(collections, ids, Arrays.hashCode(bbox), datetime, limit, offset);
    }

    @Override
    public String toString() {
        return "StacSearchRequest[collections=" + collections + ", ids=" + ids + ", bbox=" + Arrays.toString(bbox)
                + ", datetime=" + datetime + ", limit=" + limit + ", offset=" + offset + "]";
    }
}
