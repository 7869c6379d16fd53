package io.cubedash.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Per-product totals kept in {@code cubedash.product}.
 *
 * <p>
 * {@code fixedMetadata} is null when unknown (older rows never computed it),
 * and an empty object when no field is constant across the product.
 * </p>
 */
public record ProductSummary(
        int id,
        String name,
        long datasetCount,
        Instant timeEarliest,
        Instant timeLatest,
        List<String> sourceProducts,
        List<String> derivedProducts,
        JsonNode fixedMetadata,
        Instant lastRefreshTime,
        Instant lastSuccessfulSummaryTime) {

    public boolean hasSummary() {
        return lastSuccessfulSummaryTime != null;
    }
}
