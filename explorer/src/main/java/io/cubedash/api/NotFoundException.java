package io.cubedash.api;

/**
 * Unknown product, period, region or dataset. Answered with 404.
 */
public class NotFoundException extends RuntimeException {
    public NotFoundException(String message) {
        super(message);
    }
}
