package com.sashkomusic.catalogreconciler.domain.exception;

/**
 * The catalog could not be reached or answered with something we cannot use.
 */
public class CatalogUnavailableException extends ReconciliationException {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
