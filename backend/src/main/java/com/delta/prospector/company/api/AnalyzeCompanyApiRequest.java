package com.delta.prospector.company.api;

public record AnalyzeCompanyApiRequest(String companyName, String companyDomain) {
}
