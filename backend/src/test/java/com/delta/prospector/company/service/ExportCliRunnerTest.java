package com.delta.prospector.company.service;

import com.delta.prospector.company.model.ExportArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ExportCliRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void artifactIsWrittenUnderItsFileName() throws Exception {
        byte[] content = "name\nAcme\n".getBytes(StandardCharsets.UTF_8);
        ExportArtifact artifact = new ExportArtifact(3L, "companies_export_20240301_090507_p1-p1.csv", "text/csv",
            content, 1, 1, 1, Instant.parse("2024-03-01T09:05:07Z"));

        Path written = ExportCliRunner.writeArtifact(artifact, tempDir.resolve("exports"));

        assertThat(written.getFileName().toString()).isEqualTo("companies_export_20240301_090507_p1-p1.csv");
        assertThat(Files.readAllBytes(written)).isEqualTo(content);
    }
}
