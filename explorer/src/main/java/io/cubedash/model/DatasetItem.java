package io.cubedash.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * One dataset as served in listings and STAC responses.
 *
 * @param geometry GeoJSON geometry in EPSG:4326, or null when unknown
 * @param bbox     {@code [minLon, minLat, maxLon, maxLat]}, or null with no geometry
 * @param metadata the catalog document, or null when not requested
 */
public record DatasetItem(
        UUID id,
        String productName,
        Instant centerTime,
        Instant creationTime,
        String regionCode,
        Long sizeBytes,
        JsonNode geometry,
        double[] bbox,
        JsonNode metadata,
        String locationUri) {
}
