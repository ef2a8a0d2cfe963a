package com.delta.prospector.company.service;

import com.delta.prospector.config.ProspectorProperties;
import com.delta.prospector.company.http.PdlHttpClient;
import com.delta.prospector.company.model.CompanyPage;
import com.delta.prospector.company.model.HttpFetchResult;
import com.delta.prospector.company.model.PeoplePage;
import com.delta.prospector.company.model.SearchFilters;
import com.delta.prospector.company.util.UpstreamErrorClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

@Service
public class PdlCompanyDataSource implements CompanyDataSource {
    private static final Logger log = LoggerFactory.getLogger(PdlCompanyDataSource.class);
    private static final int MAX_ERROR_BODY_LENGTH = 300;

    private final PdlHttpClient httpClient;
    private final ProspectorProperties properties;
    private final ObjectMapper objectMapper;
    private final PdlResponseParser parser;

    public PdlCompanyDataSource(
        PdlHttpClient httpClient,
        ProspectorProperties properties,
        ObjectMapper objectMapper
    ) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.parser = new PdlResponseParser(objectMapper);
    }

    @Override
    public CompanyPage fetchCompanyPage(SearchFilters filters, int page, int size) {
        int safePage = Math.max(1, page);
        int safeSize = Math.max(1, size);
        ObjectNode body = companySearchBody(filters, safeSize, (long) (safePage - 1) * safeSize);
        String responseBody = post(properties.getUpstream().getCompanySearchPath(), body, "company page " + safePage);
        if (responseBody == null) {
            return new CompanyPage(List.of(), 0);
        }
        CompanyPage result = parser.parseCompanyPage(responseBody);
        log.info("API returned {} total companies, {} in page {}", result.total(), result.size(), safePage);
        return result;
    }

    @Override
    public long countCompanies(SearchFilters filters) {
        ObjectNode body = companySearchBody(filters, 1, 0L);
        String responseBody = post(properties.getUpstream().getCompanySearchPath(), body, "company count");
        if (responseBody == null) {
            return 0;
        }
        return parser.parseCompanyPage(responseBody).total();
    }

    @Override
    public CompanyPage lookupCompany(String companyName) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode bool = body.putObject("query").putObject("bool");
        ArrayNode must = bool.putArray("must");
        must.addObject().putObject("term").put("name", companyName.trim().toLowerCase(Locale.ROOT));
        body.put("size", 1);
        String responseBody = post(properties.getUpstream().getCompanySearchPath(), body, "company lookup");
        if (responseBody == null) {
            return new CompanyPage(List.of(), 0);
        }
        return parser.parseCompanyPage(responseBody);
    }

    @Override
    public PeoplePage fetchEngineeringPeople(String companyDomain, List<String> titles, int size) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode bool = body.putObject("query").putObject("bool");
        ArrayNode must = bool.putArray("must");
        must.addObject().putObject("term").put("job_company_website", companyDomain.trim().toLowerCase(Locale.ROOT));
        if (titles != null && !titles.isEmpty()) {
            ArrayNode titleTerms = must.addObject().putObject("terms").putArray("job_title");
            titles.forEach(titleTerms::add);
        }
        body.put("size", Math.max(1, size));
        String responseBody = post(properties.getUpstream().getPersonSearchPath(), body, "engineering people");
        if (responseBody == null) {
            return new PeoplePage(List.of(), 0);
        }
        return parser.parsePeoplePage(responseBody);
    }

    private ObjectNode companySearchBody(SearchFilters filters, int size, long from) {
        SearchFilters normalized = filters == null ? SearchFilters.of(null, null, null) : filters.normalized();
        ObjectNode body = objectMapper.createObjectNode();
        ArrayNode must = body.putObject("query").putObject("bool").putArray("must");

        if (normalized.minEmployees() != null || normalized.maxEmployees() != null) {
            ObjectNode range = must.addObject().putObject("range").putObject("employee_count");
            if (normalized.minEmployees() != null) {
                range.put("gte", normalized.minEmployees());
            }
            if (normalized.maxEmployees() != null) {
                range.put("lte", normalized.maxEmployees());
            }
        }
        if (!normalized.fundingStages().isEmpty()) {
            ArrayNode stages = must.addObject().putObject("terms").putArray("latest_funding_stage");
            normalized.fundingStages().forEach(stages::add);
        }
        must.addObject().putObject("exists").put("field", "total_funding_raised");
        List<String> countries = properties.getUpstream().getCountries();
        if (countries != null && !countries.isEmpty()) {
            ArrayNode countryTerms = must.addObject().putObject("terms").putArray("location.country");
            countries.forEach(country -> countryTerms.add(country.toLowerCase(Locale.ROOT)));
        }
        body.put("size", size);
        body.put("from", from);
        return body;
    }

    /**
     * Returns the response body, or null when PDL answers 404 (its way of saying "no records").
     */
    private String post(String path, ObjectNode body, String description) {
        String apiKey = properties.getUpstream().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new UpstreamException(UpstreamErrorClassifier.UNAUTHORIZED, "PDL_API_KEY is not configured");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode PDL query", e);
        }
        log.debug("PDL request {} {}: {}", path, description, json);

        HttpFetchResult result = httpClient.postJson(path, json);
        if (result.isSuccessful()) {
            return result.body();
        }
        if (result.errorCode() == null && result.statusCode() == 404) {
            log.debug("PDL returned 404 for {}; treating as no results", description);
            return null;
        }
        String reason = UpstreamErrorClassifier.classify(result);
        String message = describeFailure(reason, result);
        log.warn(
            "PDL {} at {} failed after {} attempt(s) in {} ms: {}",
            description,
            result.requestedUrl(),
            result.attempts(),
            result.duration().toMillis(),
            message
        );
        throw new UpstreamException(reason, result.statusCode() == 0 ? null : result.statusCode(), message, null);
    }

    private String describeFailure(String reason, HttpFetchResult result) {
        if (UpstreamErrorClassifier.UNAUTHORIZED.equals(reason)) {
            return "Invalid API key or unauthorized access";
        }
        if (UpstreamErrorClassifier.HTTP_429_RATE_LIMIT.equals(reason)) {
            return "API rate limit exceeded";
        }
        if (result.errorCode() != null) {
            return "Request failed: " + result.errorCode()
                + (result.errorMessage() == null ? "" : " (" + result.errorMessage() + ")");
        }
        String body = result.body() == null ? "" : result.body().trim();
        if (body.length() > MAX_ERROR_BODY_LENGTH) {
            body = body.substring(0, MAX_ERROR_BODY_LENGTH);
        }
        return "API error (" + result.statusCode() + ")" + (body.isEmpty() ? "" : ": " + body);
    }
}
