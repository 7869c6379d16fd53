package io.cubedash.model;

import java.util.List;
import java.util.UUID;

/**
 * Criteria for listing summarised datasets.
 *
 * @param products    product names to include, or empty for all
 * @param ids         dataset ids to include, or empty for all
 * @param bbox        {@code [minLon, minLat, maxLon, maxLat]} in EPSG:4326, or null
 * @param time        center-time range, or null
 * @param fields      metadata field restrictions
 * @param includeDocs whether to load each dataset's document
 */
public record DatasetQuery(
        List<String> products,
        List<UUID> ids,
        double[] bbox,
        TimeRange time,
        List<FieldFilter> fields,
        int limit,
        int offset,
        boolean includeDocs) {

    public DatasetQuery {
        products = products == null ? List.of() : List.copyOf(products);
        ids = ids == null ? List.of() : List.copyOf(ids);
        fields = fields == null ? List.of() : List.copyOf(fields);
        if (limit < 0 || offset < 0) {
            throw new IllegalArgumentException("limit and offset must not be negative");
        }
        if (bbox != null && bbox.length != 4) {
            throw new IllegalArgumentException("bbox needs four values");
        }
    }

    public static DatasetQuery forProduct(String product, TimeRange time, int limit, int offset) {
        return new DatasetQuery(List.of(product), List.of(), null, time, List.of(), limit, offset, false);
    }

    /**
     * Same criteria, different page.
     */
    public DatasetQuery page(int newLimit, int newOffset) {
        return new DatasetQuery(products, ids, bbox, time, fields, newLimit, newOffset, includeDocs);
    }
}
