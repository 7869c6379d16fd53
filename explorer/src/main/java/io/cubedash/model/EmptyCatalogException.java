package io.cubedash.model;

/**
 * Thrown when the catalog holds no datasets at all.
 */
public class EmptyCatalogException extends RuntimeException {
    public EmptyCatalogException() {
        super("The dataset catalog is empty");
    }
}
