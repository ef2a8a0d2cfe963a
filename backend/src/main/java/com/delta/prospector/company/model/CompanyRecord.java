package com.delta.prospector.company.model;

public record CompanyRecord(
    String name,
    String website,
    String linkedinUrl,
    Integer employeeCount,
    String location,
    String industry,
    Integer foundedYear,
    String fundingStage,
    Double fundingTotal
) {
}
