package io.cubedash.model;

/**
 * Outcome of refreshing one product's summaries.
 */
public enum GenerateResult {
    CREATED,
    UPDATED,
    NO_CHANGES,
    SKIPPED,
    UNSUPPORTED,
    ERROR
}
