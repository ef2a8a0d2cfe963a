package com.delta.prospector.company.service;

import com.delta.prospector.company.model.ExportArtifact;
import com.delta.prospector.company.model.ExportRunState;
import com.delta.prospector.company.model.ExportStatus;
import com.delta.prospector.company.model.ExportStatusResponse;
import com.delta.prospector.company.model.SearchFilters;
import com.delta.prospector.company.persistence.ExportRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Durable progress record for exports. The most recent row in {@code export_runs} is the current
 * export state; earlier rows are kept as the archive of finished runs.
 */
@Service
public class ExportStateService {
    private static final Logger log = LoggerFactory.getLogger(ExportStateService.class);

    private final ExportRunRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ExportStateService(ExportRunRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ExportRunState start(int fromPage, SearchFilters filters, Long resumedFromRunId) {
        int safePage = Math.max(1, fromPage);
        long runId = repository.insertRun(safePage, resumedFromRunId, encodeFilters(filters), clock.instant());
        log.info("Export run {} started at page {} (resumedFrom={})", runId, safePage, resumedFromRunId);
        return requireRun(runId);
    }

    public void recordPageSuccess(long runId, int page, int itemCount) {
        repository.recordPage(runId, page, itemCount, clock.instant());
    }

    public void markFetching(long runId, int page) {
        repository.markCurrentPage(runId, page, clock.instant());
    }

    public ExportRunState recordFailure(long runId, String reason) {
        String safeReason = reason == null || reason.isBlank() ? "unknown_error" : reason;
        if (!repository.finishRun(runId, ExportStatus.FAILED, safeReason, clock.instant())) {
            log.warn("Export run {} was already finished; failure '{}' not recorded", runId, safeReason);
        }
        return requireRun(runId);
    }

    public ExportRunState complete(long runId) {
        if (!repository.finishRun(runId, ExportStatus.COMPLETED, null, clock.instant())) {
            log.warn("Export run {} was already finished; completion not recorded", runId);
        }
        return requireRun(runId);
    }

    public ExportStatusResponse snapshot() {
        ExportRunState latest = repository.findLatestRun();
        return latest == null ? ExportStatusResponse.idle() : ExportStatusResponse.from(latest);
    }

    public ExportStatusResponse snapshot(long runId) {
        ExportRunState run = repository.findRun(runId);
        return run == null ? null : ExportStatusResponse.from(run);
    }

    public ExportRunState findRun(long runId) {
        return repository.findRun(runId);
    }

    /**
     * The latest run, if it can be resumed. Only the current state counts: a resumable run that was
     * followed by a fresh start is part of the archive.
     */
    public ExportRunState latestResumable() {
        ExportRunState latest = repository.findLatestRun();
        return latest != null && latest.canResume() ? latest : null;
    }

    public ExportRunState activeRun() {
        List<ExportRunState> processing = repository.findProcessingRuns();
        return processing.isEmpty() ? null : processing.get(processing.size() - 1);
    }

    public List<ExportRunState> processingRuns() {
        return repository.findProcessingRuns();
    }

    public void saveArtifact(ExportArtifact artifact) {
        repository.saveArtifact(artifact);
    }

    public ExportArtifact findArtifact(long runId) {
        return repository.findArtifact(runId);
    }

    private ExportRunState requireRun(long runId) {
        ExportRunState run = repository.findRun(runId);
        if (run == null) {
            throw new IllegalStateException("Export run " + runId + " not found");
        }
        return run;
    }

    private String encodeFilters(SearchFilters filters) {
        if (filters == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(filters.normalized());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode export filters", e);
        }
    }
}
