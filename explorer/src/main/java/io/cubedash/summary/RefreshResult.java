package io.cubedash.summary;

import io.cubedash.model.GenerateResult;

/**
 * Outcome of refreshing one product, with its whole-product summary when one exists.
 */
public record RefreshResult(String productName, GenerateResult result, TimePeriodOverview summary) {
}
