package com.delta.prospector.company.model;

public record ExportOutcome(
    long runId,
    ExportStatus status,
    ExportArtifact artifact,
    int pagesFetched,
    int lastSuccessfulPage,
    String failureReason
) {
    public boolean hasArtifact() {
        return artifact != null;
    }
}
