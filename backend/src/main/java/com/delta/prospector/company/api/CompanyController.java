package com.delta.prospector.company.api;

import com.delta.prospector.company.model.CompanyAnalysisResponse;
import com.delta.prospector.company.model.CompanySearchResponse;
import com.delta.prospector.company.model.SearchFilters;
import com.delta.prospector.company.service.CompanyAnalysisService;
import com.delta.prospector.company.service.CompanySearchService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/companies")
public class CompanyController {
    private final CompanySearchService searchService;
    private final CompanyAnalysisService analysisService;

    public CompanyController(CompanySearchService searchService, CompanyAnalysisService analysisService) {
        this.searchService = searchService;
        this.analysisService = analysisService;
    }

    @PostMapping("/search")
    public CompanySearchResponse search(@RequestBody(required = false) CompanySearchApiRequest request) {
        if (request == null) {
            return searchService.search(null, null, null);
        }
        SearchFilters filters = SearchFilters.of(
            CompanySearchService.parseEmployeeBound("min_employees", request.minEmployees()),
            CompanySearchService.parseEmployeeBound("max_employees", request.maxEmployees()),
            request.fundingStages()
        );
        return searchService.search(filters, request.page(), request.size());
    }

    @PostMapping("/analyze")
    public CompanyAnalysisResponse analyze(@RequestBody(required = false) AnalyzeCompanyApiRequest request) {
        return analysisService.analyze(
            request == null ? null : request.companyName(),
            request == null ? null : request.companyDomain()
        );
    }
}
