package io.cubedash.model;

/**
 * A search restriction on one metadata field. For range fields either bound
 * may be null; plain fields use {@code begin} as an exact value.
 */
public record FieldFilter(SearchField field, String begin, String end) {
}
