package com.sashkomusic.catalogreconciler.domain.exception;

public class TagWriteException extends ReconciliationException {

    public TagWriteException(String message) {
        super(message);
    }

    public TagWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
