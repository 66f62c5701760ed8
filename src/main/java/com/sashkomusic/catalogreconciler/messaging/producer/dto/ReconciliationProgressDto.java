package com.sashkomusic.catalogreconciler.messaging.producer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.catalogreconciler.domain.model.ProgressPhase;

@JsonTypeName("reconciliation_progress")
public record ReconciliationProgressDto(
        int current,
        int total,
        String currentTrackTitle,
        ProgressPhase phase
) {
}
