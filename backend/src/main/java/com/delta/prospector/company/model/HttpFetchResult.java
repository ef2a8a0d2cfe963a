package com.delta.prospector.company.model;

import java.time.Duration;

public record HttpFetchResult(
    String requestedUrl,
    int statusCode,
    String body,
    Duration duration,
    int attempts,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }
}
