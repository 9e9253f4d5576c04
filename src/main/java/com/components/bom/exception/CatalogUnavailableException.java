package com.components.bom.exception;

/**
 * Thrown when a catalog lookup is requested but no catalog search client is wired in.
 */
public class CatalogUnavailableException extends RuntimeException {

    public CatalogUnavailableException(final String message) {
        super(message);
    }
}
