package com.delta.prospector.company.model;

import java.time.Instant;

public record ExportStatusResponse(
    Long runId,
    String status,
    int totalCompanies,
    int currentPage,
    boolean canResume,
    int lastSuccessfulPage,
    String failureReason,
    Instant updatedAt
) {
    public static ExportStatusResponse idle() {
        return new ExportStatusResponse(null, ExportStatus.IDLE.name(), 0, 0, false, 0, null, null);
    }

    public static ExportStatusResponse from(ExportRunState state) {
        return new ExportStatusResponse(
            state.runId(),
            state.status().name(),
            state.totalCompanies(),
            state.currentPage(),
            state.canResume(),
            state.lastSuccessfulPage(),
            state.failureReason(),
            state.updatedAt()
        );
    }
}
