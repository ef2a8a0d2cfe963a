package com.delta.prospector.company.api;

public record ExportApiRequest(Integer startPage, Boolean resume) {
}
