package com.delta.prospector.company.model;

import java.time.Instant;

public record ExportArtifact(
    long runId,
    String fileName,
    String contentType,
    byte[] content,
    int startPage,
    int endPage,
    int companyCount,
    Instant createdAt
) {
    public ExportArtifact {
        content = content == null ? new byte[0] : content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }
}
