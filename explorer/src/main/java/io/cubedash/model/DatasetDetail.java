package io.cubedash.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A single catalog dataset with its summary-table spatial fields.
 */
public record DatasetDetail(
        UUID id,
        String productName,
        JsonNode metadata,
        Instant added,
        Instant archived,
        List<String> locations,
        JsonNode footprint,
        String regionCode) {
}
