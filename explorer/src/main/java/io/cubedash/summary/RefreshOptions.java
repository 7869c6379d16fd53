package io.cubedash.summary;

import java.time.Duration;

/**
 * How a product refresh should treat existing summaries.
 *
 * @param forceRefresh             regenerate every period, not just changed ones
 * @param recreateDatasetExtents   rescan every dataset's extent, not just recent changes
 * @param resetIncrementalPosition forget the last scan position before starting
 * @param minimumScanWindow        overlap subtracted from the last scan position, or null for the configured one
 */
public record RefreshOptions(
        boolean forceRefresh,
        boolean recreateDatasetExtents,
        boolean resetIncrementalPosition,
        Duration minimumScanWindow) {

    public static RefreshOptions incremental() {
        return new RefreshOptions(false, false, false, null);
    }
}
