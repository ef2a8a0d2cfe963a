package com.delta.prospector.company.service;

import com.delta.prospector.company.model.CompanyRecord;
import com.delta.prospector.company.model.ExportArtifact;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Component
public class ExportArtifactWriter {
    public static final String CONTENT_TYPE = "text/csv";
    static final String[] HEADER = {
        "name",
        "website",
        "linkedin_url",
        "total_employees",
        "location",
        "industry",
        "founded_year",
        "funding_stage",
        "funding_total"
    };
    private static final String MISSING = "N/A";
    private static final DateTimeFormatter FILE_TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public ExportArtifactWriter(Clock clock) {
        this.clock = clock;
    }

    public ExportArtifact write(long runId, List<CompanyRecord> companies, int firstPage, int lastPage) {
        Instant createdAt = clock.instant();
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .setRecordSeparator("\n")
            .build();

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (CSVPrinter printer = new CSVPrinter(new OutputStreamWriter(buffer, StandardCharsets.UTF_8), format)) {
            for (CompanyRecord company : companies) {
                printer.printRecord(
                    text(company.name()),
                    text(company.website()),
                    text(company.linkedinUrl()),
                    number(company.employeeCount()),
                    text(company.location()),
                    text(company.industry()),
                    number(company.foundedYear()),
                    text(company.fundingStage()),
                    number(company.fundingTotal())
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write export CSV", e);
        }

        return new ExportArtifact(
            runId,
            fileName(createdAt, firstPage, lastPage),
            CONTENT_TYPE,
            buffer.toByteArray(),
            firstPage,
            lastPage,
            companies.size(),
            createdAt
        );
    }

    static String fileName(Instant createdAt, int firstPage, int lastPage) {
        return "companies_export_" + FILE_TIMESTAMP.format(createdAt) + "_p" + firstPage + "-p" + lastPage + ".csv";
    }

    private String text(String value) {
        return value == null || value.isBlank() ? MISSING : value;
    }

    private String number(Number value) {
        if (value == null) {
            return MISSING;
        }
        if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)) {
            return Long.toString(d.longValue());
        }
        return value.toString();
    }
}
