package com.sashkomusic.catalogreconciler.domain.model;

import java.util.List;

public record BatchResult(
        int total,
        int successCount,
        int failedCount,
        List<ReconciliationResult> results
) {

    public static BatchResult of(List<ReconciliationResult> results) {
        List<ReconciliationResult> copy = List.copyOf(results);
        int success = (int) copy.stream().filter(ReconciliationResult::success).count();
        return new BatchResult(copy.size(), success, copy.size() - success, copy);
    }
}
