package com.delta.prospector.company.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineeringAnalysis(
    Integer totalEmployees,
    Integer engineeringCount,
    Double engineeringPercentage,
    List<EngineeringPerson> engineeringEmployees,
    List<EngineeringPerson> engineeringLeaders,
    String error
) {
    public static EngineeringAnalysis failed(String error) {
        return new EngineeringAnalysis(null, null, null, null, null, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public List<EngineeringPerson> leadersOrEmpty() {
        return engineeringLeaders == null ? List.of() : engineeringLeaders;
    }
}
