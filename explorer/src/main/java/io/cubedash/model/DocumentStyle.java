package io.cubedash.model;

/**
 * Layout of dataset metadata documents in the catalog.
 */
public enum DocumentStyle {
    /** EO3: {@code properties}, {@code crs}, {@code geometry}, {@code measurements}. */
    EO3,
    /** Legacy EO: {@code extent}, {@code grid_spatial}, {@code image}. */
    EO
}
