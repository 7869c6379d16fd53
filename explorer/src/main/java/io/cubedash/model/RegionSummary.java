package io.cubedash.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A product's footprint and dataset count within one region.
 *
 * @param regionCode empty when the datasets carry no region
 * @param footprint  GeoJSON geometry in EPSG:4326
 */
public record RegionSummary(String regionCode, long count, Instant generationTime, JsonNode footprint) {
}
