package com.sashkomusic.catalogreconciler.messaging.producer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.sashkomusic.catalogreconciler.domain.model.BatchResult;

@JsonTypeName("reconciliation_complete")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconciliationCompleteDto(
        String requestId,
        boolean success,
        String message,
        BatchResult result
) {
    public static ReconciliationCompleteDto completed(String requestId, BatchResult result) {
        String message = String.format("%d of %d tracks reconciled", result.successCount(), result.total());
        return new ReconciliationCompleteDto(requestId, true, message, result);
    }

    public static ReconciliationCompleteDto failed(String requestId, String message) {
        return new ReconciliationCompleteDto(requestId, false, message, null);
    }
}
