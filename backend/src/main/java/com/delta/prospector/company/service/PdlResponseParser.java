package com.delta.prospector.company.service;

import com.delta.prospector.company.model.CompanyPage;
import com.delta.prospector.company.model.CompanyRecord;
import com.delta.prospector.company.model.EngineeringPerson;
import com.delta.prospector.company.model.PeoplePage;
import com.delta.prospector.company.util.UpstreamErrorClassifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw PDL search responses into fixed-shape records. Absent or blank fields become null.
 */
class PdlResponseParser {
    private final ObjectMapper objectMapper;

    PdlResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    CompanyPage parseCompanyPage(String body) {
        JsonNode root = readRoot(body);
        List<CompanyRecord> companies = new ArrayList<>();
        for (JsonNode node : dataArray(root)) {
            companies.add(toCompany(node));
        }
        return new CompanyPage(companies, readTotal(root, companies.size()));
    }

    PeoplePage parsePeoplePage(String body) {
        JsonNode root = readRoot(body);
        List<EngineeringPerson> people = new ArrayList<>();
        for (JsonNode node : dataArray(root)) {
            people.add(new EngineeringPerson(
                text(node, "full_name"),
                text(node, "job_title"),
                firstText(node, "location_country", "location_name"),
                text(node, "linkedin_url")
            ));
        }
        return new PeoplePage(people, readTotal(root, people.size()));
    }

    CompanyRecord toCompany(JsonNode node) {
        return new CompanyRecord(
            text(node, "name"),
            text(node, "website"),
            text(node, "linkedin_url"),
            integer(node, "employee_count"),
            formatLocation(node.get("location")),
            text(node, "industry"),
            integer(node, "founded"),
            text(node, "latest_funding_stage"),
            decimal(node, "total_funding_raised")
        );
    }

    private JsonNode readRoot(String body) {
        if (body == null || body.isBlank()) {
            throw malformed("empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException(
                UpstreamErrorClassifier.MALFORMED_RESPONSE,
                null,
                "Invalid JSON response from API",
                e
            );
        }
        if (root == null || !root.isObject()) {
            throw malformed("response is not a JSON object");
        }
        return root;
    }

    private JsonNode dataArray(JsonNode root) {
        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            return objectMapper.createArrayNode();
        }
        if (!data.isArray()) {
            throw malformed("'data' is not an array");
        }
        return data;
    }

    private long readTotal(JsonNode root, int fallback) {
        JsonNode total = root.get("total");
        if (total == null || total.isNull()) {
            return fallback;
        }
        if (!total.canConvertToLong()) {
            throw malformed("'total' is not a number");
        }
        return total.asLong();
    }

    private String formatLocation(JsonNode location) {
        if (location == null || location.isNull()) {
            return null;
        }
        if (location.isTextual()) {
            return blankToNull(location.asText());
        }
        List<String> parts = new ArrayList<>();
        for (String field : List.of("locality", "region", "country")) {
            String value = text(location, field);
            if (value != null) {
                parts.add(value);
            }
        }
        if (!parts.isEmpty()) {
            return String.join(", ", parts);
        }
        return text(location, "name");
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return blankToNull(value.asText());
    }

    private Integer integer(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asInt();
        }
        if (value.isTextual() && value.asText().trim().matches("\\d+")) {
            return Integer.parseInt(value.asText().trim());
        }
        return null;
    }

    private Double decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isNumber()) {
            return null;
        }
        return value.asDouble();
    }

    private String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private UpstreamException malformed(String detail) {
        return new UpstreamException(
            UpstreamErrorClassifier.MALFORMED_RESPONSE,
            "Malformed response from API: " + detail
        );
    }
}
