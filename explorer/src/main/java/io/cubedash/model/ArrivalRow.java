package io.cubedash.model;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Datasets of one product added to the catalog on one day.
 */
public record ArrivalRow(LocalDate day, String productName, long datasetCount, List<UUID> sampleIds) {
}
