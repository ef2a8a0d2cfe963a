package com.delta.prospector.company.model;

public enum QueryKind {
    COMPANY_PAGE,
    COMPANY_COUNT,
    COMPANY_LOOKUP,
    ENGINEERING_PEOPLE
}
