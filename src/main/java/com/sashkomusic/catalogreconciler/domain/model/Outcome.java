package com.sashkomusic.catalogreconciler.domain.model;

public enum Outcome {
    APPLIED,
    UNCHANGED,
    NO_MATCH,
    SEARCH_ERROR,
    APPLY_ERROR,
    SKIPPED;

    public boolean isSuccess() {
        return this == APPLIED || this == UNCHANGED;
    }
}
