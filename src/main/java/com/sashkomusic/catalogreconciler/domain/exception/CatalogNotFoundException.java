package com.sashkomusic.catalogreconciler.domain.exception;

import lombok.Getter;

@Getter
public class CatalogNotFoundException extends ReconciliationException {

    private final long catalogId;

    public CatalogNotFoundException(long catalogId) {
        super("Catalog track not found or restricted: " + catalogId);
        this.catalogId = catalogId;
    }
}
