package com.delta.prospector.company.service;

import com.delta.prospector.company.cache.QueryCacheStore;
import com.delta.prospector.company.model.CompanyPage;
import com.delta.prospector.company.model.CompanySearchResponse;
import com.delta.prospector.company.model.QueryFingerprint;
import com.delta.prospector.company.model.SearchFilters;
import com.delta.prospector.config.ProspectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Interactive, paginated company search. Pages and totals both go through the query cache;
 * export progress is never read or written here.
 */
@Service
public class CompanySearchService {
    private static final Logger log = LoggerFactory.getLogger(CompanySearchService.class);

    private final QueryCacheStore cacheStore;
    private final CompanyDataSource dataSource;
    private final ProspectorProperties properties;

    public CompanySearchService(
        QueryCacheStore cacheStore,
        CompanyDataSource dataSource,
        ProspectorProperties properties
    ) {
        this.cacheStore = cacheStore;
        this.dataSource = dataSource;
        this.properties = properties;
    }

    public CompanySearchResponse search(SearchFilters filters, Integer page, Integer size) {
        int safePage = page == null ? 1 : page;
        int safeSize = size == null ? properties.getSearch().getDefaultPageSize() : size;
        validate(filters, safePage, safeSize);
        SearchFilters normalized = filters == null ? SearchFilters.of(null, null, null) : filters.normalized();

        long total = countMatches(normalized);
        int totalPages = totalPages(total, safeSize);
        if (safePage > totalPages) {
            log.debug("Search page {} is beyond {} total page(s); skipping upstream page fetch", safePage, totalPages);
            return new CompanySearchResponse(List.of(), total, safePage, safeSize, totalPages);
        }

        CompanyPage result = cacheStore.getOrFetch(
            QueryFingerprint.forCompanyPage(normalized, safePage, safeSize),
            properties.getCache().searchTtl(),
            CompanyPage.class,
            () -> dataSource.fetchCompanyPage(normalized, safePage, safeSize)
        );
        return new CompanySearchResponse(result.companies(), total, safePage, safeSize, totalPages);
    }

    /**
     * Parses an employee bound supplied as text. Blank means "no bound"; anything else must be a
     * string of digits.
     */
    public static Integer parseEmployeeBound(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (!value.chars().allMatch(Character::isDigit)) {
            throw new InvalidSearchFiltersException(field + " must be a non-negative integer");
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidSearchFiltersException(field + " is out of range");
        }
    }

    static int totalPages(long total, int size) {
        if (total <= 0) {
            return 0;
        }
        long pages = (total + size - 1) / size;
        return pages > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) pages;
    }

    private long countMatches(SearchFilters filters) {
        Long total = cacheStore.getOrFetch(
            QueryFingerprint.forCompanyCount(filters),
            properties.getCache().countTtl(),
            Long.class,
            () -> dataSource.countCompanies(filters)
        );
        return total == null ? 0L : total;
    }

    private void validate(SearchFilters filters, int page, int size) {
        if (page < 1) {
            throw new InvalidSearchFiltersException("page must be >= 1");
        }
        int maxSize = properties.getSearch().getMaxPageSize();
        if (size < 1 || size > maxSize) {
            throw new InvalidSearchFiltersException("size must be between 1 and " + maxSize);
        }
        if (filters == null) {
            return;
        }
        Integer min = filters.minEmployees();
        Integer max = filters.maxEmployees();
        if (min != null && min < 0) {
            throw new InvalidSearchFiltersException("min_employees must be a non-negative integer");
        }
        if (max != null && max < 0) {
            throw new InvalidSearchFiltersException("max_employees must be a non-negative integer");
        }
        if (min != null && max != null && min > max) {
            throw new InvalidSearchFiltersException("min_employees must not exceed max_employees");
        }
    }
}
