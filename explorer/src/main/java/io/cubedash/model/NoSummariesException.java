package io.cubedash.model;

/**
 * Thrown when the catalog has products but none of them has been summarised yet.
 */
public class NoSummariesException extends IllegalStateException {
    public NoSummariesException() {
        super("No products are summarised. Run `cubedash-gen --all` to generate some.");
    }
}
