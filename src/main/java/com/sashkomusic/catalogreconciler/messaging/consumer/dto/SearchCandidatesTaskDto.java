package com.sashkomusic.catalogreconciler.messaging.consumer.dto;

import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

@JsonTypeName("search_candidates")
public record SearchCandidatesTaskDto(
        String requestId,
        List<Long> trackIds
) {
}
