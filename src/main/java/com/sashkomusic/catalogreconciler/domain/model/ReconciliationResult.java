package com.sashkomusic.catalogreconciler.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconciliationResult(
        Long localTrackId,
        boolean success,
        Long catalogId,
        MergedTagSet appliedTags,
        String error,
        Outcome outcome,
        String warning
) {
    public static final String NOT_SELECTED = "not selected";

    public static ReconciliationResult applied(Long localTrackId, long catalogId, MergedTagSet tags) {
        return new ReconciliationResult(localTrackId, true, catalogId, tags, null, Outcome.APPLIED, null);
    }

    public static ReconciliationResult unchanged(Long localTrackId, long catalogId) {
        return new ReconciliationResult(localTrackId, true, catalogId, MergedTagSet.empty(), null,
                Outcome.UNCHANGED, null);
    }

    public static ReconciliationResult failure(Long localTrackId, Outcome outcome, String error) {
        return new ReconciliationResult(localTrackId, false, null, null, error, outcome, null);
    }

    public static ReconciliationResult failure(Long localTrackId, Long catalogId, Outcome outcome, String error) {
        return new ReconciliationResult(localTrackId, false, catalogId, null, error, outcome, null);
    }

    public static ReconciliationResult notSelected(Long localTrackId) {
        return new ReconciliationResult(localTrackId, false, null, null, NOT_SELECTED, Outcome.SKIPPED, null);
    }

    public ReconciliationResult withWarning(String warning) {
        return new ReconciliationResult(localTrackId, success, catalogId, appliedTags, error, outcome, warning);
    }
}
