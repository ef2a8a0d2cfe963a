package com.delta.prospector.company.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class ExportConflictException extends RuntimeException {
    private final long activeRunId;

    public ExportConflictException(long activeRunId, String message) {
        super(message);
        this.activeRunId = activeRunId;
    }

    public long getActiveRunId() {
        return activeRunId;
    }
}
