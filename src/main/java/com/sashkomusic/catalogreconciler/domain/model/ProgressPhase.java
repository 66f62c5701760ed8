package com.sashkomusic.catalogreconciler.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressPhase {
    SEARCHING("searching"),
    DOWNLOADING("downloading"),
    APPLYING_TAGS("applying_tags"),
    COMPLETE("complete");

    private final String wireName;

    ProgressPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
