package com.delta.prospector.company.model;

import java.util.List;

public record CompanyAnalysisResponse(
    CompanyRecord company,
    EngineeringAnalysis engineering,
    List<PersonalizedMessage> personalizedMessages
) {
}
