package io.cubedash.model;

/**
 * Footprint/metadata completeness of one product's spatial rows.
 */
public record SpatialQuality(
        String productName,
        long count,
        long missingFootprint,
        long footprintSize,
        double footprintStddev,
        long missingSrid,
        long hasFileSize,
        long hasRegion) {
}
