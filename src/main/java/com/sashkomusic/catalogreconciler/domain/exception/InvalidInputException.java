package com.sashkomusic.catalogreconciler.domain.exception;

public class InvalidInputException extends ReconciliationException {

    public InvalidInputException(String message) {
        super(message);
    }
}
