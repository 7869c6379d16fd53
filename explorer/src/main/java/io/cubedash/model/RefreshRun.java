package io.cubedash.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One logged refresh of a product's summaries.
 */
public record RefreshRun(
        UUID runId,
        String jobName,
        String productName,
        Instant startedAt,
        Instant finishedAt,
        String status,
        String notes) {
}
