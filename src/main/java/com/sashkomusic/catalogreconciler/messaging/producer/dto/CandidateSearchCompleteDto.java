package com.sashkomusic.catalogreconciler.messaging.producer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.catalogreconciler.domain.model.CandidateSearchResult;

@JsonTypeName("candidate_search_complete")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CandidateSearchCompleteDto(
        String requestId,
        boolean success,
        String message,
        CandidateSearchResult result
) {
    public static CandidateSearchCompleteDto completed(String requestId, CandidateSearchResult result) {
        String message = String.format("%d of %d tracks have candidates", result.withCandidates(), result.total());
        return new CandidateSearchCompleteDto(requestId, true, message, result);
    }

    public static CandidateSearchCompleteDto failed(String requestId, String message) {
        return new CandidateSearchCompleteDto(requestId, false, message, null);
    }
}
