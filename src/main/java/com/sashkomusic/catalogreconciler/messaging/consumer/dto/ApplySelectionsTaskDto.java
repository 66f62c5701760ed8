package com.sashkomusic.catalogreconciler.messaging.consumer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.catalogreconciler.domain.model.TrackSelection;

import java.util.List;

@JsonTypeName("apply_selections")
public record ApplySelectionsTaskDto(
        String requestId,
        List<TrackSelection> selections
) {
}
