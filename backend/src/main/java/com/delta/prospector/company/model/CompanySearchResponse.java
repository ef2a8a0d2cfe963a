package com.delta.prospector.company.model;

import java.util.List;

public record CompanySearchResponse(
    List<CompanyRecord> companies,
    long total,
    int page,
    int size,
    int totalPages
) {
}
