package com.sashkomusic.catalogreconciler.messaging.consumer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.catalogreconciler.domain.model.ReconciliationMode;

import java.util.List;

@JsonTypeName("reconcile_tracks")
public record ReconcileTracksTaskDto(
        String requestId,
        List<Long> trackIds,
        ReconciliationMode mode
) {
}
