package com.delta.prospector.company.service;

import com.delta.prospector.company.cache.QueryCacheStore;
import com.delta.prospector.company.model.CompanyAnalysisResponse;
import com.delta.prospector.company.model.CompanyPage;
import com.delta.prospector.company.model.CompanyRecord;
import com.delta.prospector.company.model.EngineeringAnalysis;
import com.delta.prospector.company.model.PeoplePage;
import com.delta.prospector.company.model.PersonalizedMessage;
import com.delta.prospector.company.model.QueryFingerprint;
import com.delta.prospector.config.ProspectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Service
public class CompanyAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(CompanyAnalysisService.class);

    static final String NO_DOMAIN = "Could not determine company domain";
    static final String NO_ENGINEERING_DATA = "Could not retrieve engineering data";

    private final QueryCacheStore cacheStore;
    private final CompanyDataSource dataSource;
    private final EngineeringTeamAnalyzer analyzer;
    private final OutreachMessageComposer messageComposer;
    private final ProspectorProperties properties;

    public CompanyAnalysisService(
        QueryCacheStore cacheStore,
        CompanyDataSource dataSource,
        EngineeringTeamAnalyzer analyzer,
        OutreachMessageComposer messageComposer,
        ProspectorProperties properties
    ) {
        this.cacheStore = cacheStore;
        this.dataSource = dataSource;
        this.analyzer = analyzer;
        this.messageComposer = messageComposer;
        this.properties = properties;
    }

    public CompanyAnalysisResponse analyze(String companyName, String companyDomain) {
        String name = blankToNull(companyName);
        String domain = normalizeDomain(companyDomain);
        if (name == null && domain == null) {
            throw new InvalidAnalysisRequestException("Either company_name or company_domain is required");
        }

        CompanyRecord company = null;
        if (name != null) {
            company = lookup(name);
            String websiteDomain = normalizeDomain(company.website());
            if (websiteDomain != null) {
                domain = websiteDomain;
            }
        }

        if (domain == null) {
            return new CompanyAnalysisResponse(company, EngineeringAnalysis.failed(NO_DOMAIN), List.of());
        }

        EngineeringAnalysis engineering;
        try {
            engineering = analyzer.analyze(
                engineeringPeople(domain),
                company == null ? null : company.employeeCount()
            );
        } catch (UpstreamException e) {
            log.warn("Engineering lookup failed for {} ({}): {}", domain, e.getReasonCode(), e.getMessage());
            return new CompanyAnalysisResponse(company, EngineeringAnalysis.failed(NO_ENGINEERING_DATA), List.of());
        }

        List<PersonalizedMessage> messages = messageComposer.compose(company, engineering);
        return new CompanyAnalysisResponse(company, engineering, messages);
    }

    private CompanyRecord lookup(String name) {
        CompanyPage page = cacheStore.getOrFetch(
            QueryFingerprint.forCompanyLookup(name),
            properties.getCache().lookupTtl(),
            CompanyPage.class,
            () -> dataSource.lookupCompany(name)
        );
        if (page == null || !page.hasCompanies() || page.companies().get(0).name() == null) {
            throw new CompanyNotFoundException(name);
        }
        return page.companies().get(0);
    }

    private PeoplePage engineeringPeople(String domain) {
        int size = properties.getAnalysis().getPeoplePageSize();
        List<String> titles = properties.getAnalysis().getEngineeringTitles();
        return cacheStore.getOrFetch(
            QueryFingerprint.forEngineeringPeople(domain, size),
            properties.getCache().peopleTtl(),
            PeoplePage.class,
            () -> dataSource.fetchEngineeringPeople(domain, titles, size)
        );
    }

    /**
     * Reduces a website or domain to its host: scheme, path, query and port are dropped.
     */
    static String normalizeDomain(String raw) {
        String value = blankToNull(raw);
        if (value == null) {
            return null;
        }
        value = value.toLowerCase(Locale.ROOT);
        int schemeIdx = value.indexOf("://");
        if (schemeIdx >= 0) {
            value = value.substring(schemeIdx + 3);
        }
        for (char delimiter : new char[]{'/', '?', '#', ':'}) {
            int idx = value.indexOf(delimiter);
            if (idx >= 0) {
                value = value.substring(0, idx);
            }
        }
        return value.isBlank() ? null : value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
