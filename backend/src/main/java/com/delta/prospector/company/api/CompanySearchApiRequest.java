package com.delta.prospector.company.api;

import java.util.List;

/**
 * Employee bounds arrive as text so that both JSON numbers and digit strings are accepted.
 */
public record CompanySearchApiRequest(
    String minEmployees,
    String maxEmployees,
    List<String> fundingStages,
    Integer page,
    Integer size
) {
}
