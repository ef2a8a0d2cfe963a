package com.delta.prospector.company.model;

import java.time.Instant;

public record ExportRunState(
    long runId,
    ExportStatus status,
    int startPage,
    int currentPage,
    int lastSuccessfulPage,
    int totalCompanies,
    String failureReason,
    Long resumedFromRunId,
    String filtersJson,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt
) {
    public boolean canResume() {
        boolean resumableStatus = status == ExportStatus.FAILED
            || (status == ExportStatus.IDLE && currentPage > 0);
        return resumableStatus && lastSuccessfulPage > 0;
    }

    public int resumePage() {
        return lastSuccessfulPage + 1;
    }
}
