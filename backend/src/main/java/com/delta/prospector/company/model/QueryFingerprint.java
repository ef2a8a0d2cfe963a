package com.delta.prospector.company.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache key: SHA-256 over a canonical, key-sorted JSON encoding of the query.
 */
public record QueryFingerprint(String value, QueryKind kind) {
    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public static QueryFingerprint forCompanyPage(SearchFilters filters, int page, int size) {
        Map<String, Object> parts = filterParts(filters);
        parts.put("page", page);
        parts.put("size", size);
        return of(QueryKind.COMPANY_PAGE, parts);
    }

    public static QueryFingerprint forCompanyCount(SearchFilters filters) {
        return of(QueryKind.COMPANY_COUNT, filterParts(filters));
    }

    public static QueryFingerprint forCompanyLookup(String companyName) {
        Map<String, Object> parts = new TreeMap<>();
        parts.put("name", companyName == null ? "" : companyName.trim().toLowerCase(Locale.ROOT));
        return of(QueryKind.COMPANY_LOOKUP, parts);
    }

    public static QueryFingerprint forEngineeringPeople(String domain, int size) {
        Map<String, Object> parts = new TreeMap<>();
        parts.put("domain", domain == null ? "" : domain.trim().toLowerCase(Locale.ROOT));
        parts.put("size", size);
        return of(QueryKind.ENGINEERING_PEOPLE, parts);
    }

    private static Map<String, Object> filterParts(SearchFilters filters) {
        SearchFilters normalized = filters == null
            ? SearchFilters.of(null, null, null)
            : filters.normalized();
        Map<String, Object> parts = new TreeMap<>();
        parts.put("min_employees", normalized.minEmployees());
        parts.put("max_employees", normalized.maxEmployees());
        parts.put("funding_stages", normalized.fundingStages());
        return parts;
    }

    private static QueryFingerprint of(QueryKind kind, Map<String, Object> parts) {
        parts.put("kind", kind.name().toLowerCase(Locale.ROOT));
        try {
            String canonical = CANONICAL.writeValueAsString(parts);
            return new QueryFingerprint(sha256Hex(canonical), kind);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode query fingerprint", e);
        }
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder out = new StringBuilder();
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
