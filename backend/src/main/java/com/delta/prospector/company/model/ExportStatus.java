package com.delta.prospector.company.model;

public enum ExportStatus {
    IDLE,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
