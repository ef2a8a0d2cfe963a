package com.delta.prospector.company.service;

import com.delta.prospector.company.model.CompanyRecord;
import com.delta.prospector.company.model.ExportArtifact;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExportArtifactWriterTest {
    private final ExportArtifactWriter writer =
        new ExportArtifactWriter(Clock.fixed(Instant.parse("2024-03-01T09:05:07Z"), ZoneOffset.UTC));

    @Test
    void writesHeaderAndRendersMissingValuesAsNotAvailable() {
        CompanyRecord full = new CompanyRecord("Acme", "acme.io", "linkedin.com/company/acme", 120,
            "Toronto, Ontario, Canada", "computer software", 2016, "series_b", 3.0e7);
        CompanyRecord sparse = new CompanyRecord("Sparse", null, " ", null, null, null, null, null, null);

        ExportArtifact artifact = writer.write(42L, List.of(full, sparse), 1, 2);
        String[] lines = new String(artifact.content(), StandardCharsets.UTF_8).split("\n");

        assertThat(lines[0]).isEqualTo(
            "name,website,linkedin_url,total_employees,location,industry,founded_year,funding_stage,funding_total");
        assertThat(lines[1]).isEqualTo(
            "Acme,acme.io,linkedin.com/company/acme,120,\"Toronto, Ontario, Canada\",computer software,2016,series_b,30000000");
        assertThat(lines[2]).isEqualTo("Sparse,N/A,N/A,N/A,N/A,N/A,N/A,N/A,N/A");
        assertThat(artifact.companyCount()).isEqualTo(2);
        assertThat(artifact.contentType()).isEqualTo("text/csv");
    }

    @Test
    void fileNameCarriesUtcTimestampAndPageRange() {
        ExportArtifact artifact = writer.write(7L, List.of(), 5, 9);

        assertThat(artifact.fileName()).isEqualTo("companies_export_20240301_090507_p5-p9.csv");
        assertThat(artifact.runId()).isEqualTo(7L);
    }
}
