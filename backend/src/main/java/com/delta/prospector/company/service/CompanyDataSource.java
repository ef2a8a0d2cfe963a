package com.delta.prospector.company.service;

import com.delta.prospector.company.model.CompanyPage;
import com.delta.prospector.company.model.PeoplePage;
import com.delta.prospector.company.model.SearchFilters;
import java.util.List;

/**
 * Upstream company database. Every method either returns a normalized payload or throws
 * {@link UpstreamException}; an empty page means there are no more results.
 */
public interface CompanyDataSource {
  CompanyPage fetchCompanyPage(SearchFilters filters, int page, int size);

  long countCompanies(SearchFilters filters);

  CompanyPage lookupCompany(String companyName);

  PeoplePage fetchEngineeringPeople(String companyDomain, List<String> titles, int size);
}
