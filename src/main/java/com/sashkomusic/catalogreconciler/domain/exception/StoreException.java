package com.sashkomusic.catalogreconciler.domain.exception;

public class StoreException extends ReconciliationException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
