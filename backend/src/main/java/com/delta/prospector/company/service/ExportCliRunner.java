package com.delta.prospector.company.service;

import com.delta.prospector.company.model.ExportArtifact;
import com.delta.prospector.company.model.ExportOutcome;
import com.delta.prospector.config.ProspectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@Component
@Order(10)
public class ExportCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ExportCliRunner.class);

    private final ProspectorProperties properties;
    private final ExportOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public ExportCliRunner(
        ProspectorProperties properties,
        ExportOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ProspectorProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        ExportOutcome outcome = cli.isResume()
            ? orchestratorService.resume()
            : orchestratorService.runExport(cli.getStartPage());
        log.info(
            "Export run {} finished with status {} after {} page(s); last successful page {}",
            outcome.runId(),
            outcome.status(),
            outcome.pagesFetched(),
            outcome.lastSuccessfulPage()
        );
        if (outcome.failureReason() != null) {
            log.warn("Export run {} failure: {}", outcome.runId(), outcome.failureReason());
        }
        if (outcome.hasArtifact()) {
            Path written = writeArtifact(outcome.artifact(), Paths.get(cli.getOutputDir()));
            log.info("Wrote {} companies to {}", outcome.artifact().companyCount(), written.toAbsolutePath());
        } else {
            log.warn("Export run {} produced no companies", outcome.runId());
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> outcome.failureReason() == null ? 0 : 1);
            System.exit(exitCode);
        }
    }

    static Path writeArtifact(ExportArtifact artifact, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
            Path target = outputDir.resolve(artifact.fileName());
            Files.write(target, artifact.content());
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to write export file to " + outputDir, e);
        }
    }
}
