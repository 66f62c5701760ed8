package com.sashkomusic.catalogreconciler.domain.model;

public record ProgressEvent(
        int currentIndex,
        int total,
        String currentTrackTitle,
        ProgressPhase phase
) {
}
