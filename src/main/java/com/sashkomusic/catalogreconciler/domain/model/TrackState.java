package com.sashkomusic.catalogreconciler.domain.model;

/**
 * Per-track reconciliation states. Terminal states map onto {@link Outcome}.
 */
public enum TrackState {
    PENDING,
    SEARCHING,
    FOUND,
    NO_MATCH,
    SEARCH_ERROR,
    MANUAL_SELECTION,
    APPLYING,
    APPLIED,
    APPLY_ERROR,
    SKIPPED
}
