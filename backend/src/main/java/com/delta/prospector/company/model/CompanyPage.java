package com.delta.prospector.company.model;

import java.util.List;

public record CompanyPage(List<CompanyRecord> companies, long total) {
    public CompanyPage {
        companies = companies == null ? List.of() : List.copyOf(companies);
        total = Math.max(0, total);
    }

    public int size() {
        return companies.size();
    }

    public boolean hasCompanies() {
        return !companies.isEmpty();
    }
}
