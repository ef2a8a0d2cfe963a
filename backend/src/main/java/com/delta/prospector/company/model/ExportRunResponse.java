package com.delta.prospector.company.model;

public record ExportRunResponse(long runId, String status, String statusUrl, String artifactUrl) {}
