package com.delta.prospector.company.service;

import com.delta.prospector.company.cache.QueryCacheStore;
import com.delta.prospector.company.model.CompanyPage;
import com.delta.prospector.company.model.CompanyRecord;
import com.delta.prospector.company.model.ExportArtifact;
import com.delta.prospector.company.model.ExportOutcome;
import com.delta.prospector.company.model.ExportRunResponse;
import com.delta.prospector.company.model.ExportRunState;
import com.delta.prospector.company.model.ExportStatusResponse;
import com.delta.prospector.company.model.QueryFingerprint;
import com.delta.prospector.company.model.SearchFilters;
import com.delta.prospector.company.util.UpstreamErrorClassifier;
import com.delta.prospector.config.ProspectorProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a paginated export: pages are fetched in ascending order through the query cache, each
 * success is recorded before the next page is requested, and any failure stops the run with its
 * progress intact so that {@link #resume()} continues at the first page not yet fetched.
 */
@Service
public class ExportOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ExportOrchestratorService.class);

    static final String REASON_STOPPED = "stopped_by_operator";
    static final String REASON_INTERRUPTED = "interrupted";
    static final String REASON_ABORTED = "run_aborted";

    private final QueryCacheStore cacheStore;
    private final CompanyDataSource dataSource;
    private final ExportStateService stateService;
    private final ExportArtifactWriter artifactWriter;
    private final ExecutorService exportRunExecutor;
    private final ProspectorProperties properties;
    private final ObjectMapper objectMapper;
    private final Object startLock = new Object();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Set<Long> runningRunIds = ConcurrentHashMap.newKeySet();
    private final Set<Long> unfinishedRunIds = ConcurrentHashMap.newKeySet();

    public ExportOrchestratorService(
        QueryCacheStore cacheStore,
        CompanyDataSource dataSource,
        ExportStateService stateService,
        ExportArtifactWriter artifactWriter,
        @Qualifier("exportRunExecutor") ExecutorService exportRunExecutor,
        ProspectorProperties properties,
        ObjectMapper objectMapper
    ) {
        this.cacheStore = cacheStore;
        this.dataSource = dataSource;
        this.stateService = stateService;
        this.artifactWriter = artifactWriter;
        this.exportRunExecutor = exportRunExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ExportOutcome runExport(int startPage) {
        ExportRunState run = beginFresh(startPage);
        return runWithId(run);
    }

    public ExportOutcome resume() {
        ExportRunState run = beginResume();
        return runWithId(run);
    }

    public ExportRunResponse startAsync(Integer startPage, boolean resume) {
        ExportRunState run = resume ? beginResume() : beginFresh(startPage == null ? 1 : startPage);
        long runId = run.runId();
        try {
            exportRunExecutor.submit(() -> {
                try {
                    runWithId(run);
                } catch (RuntimeException | Error e) {
                    log.error("Async export run {} aborted", runId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            runningRunIds.remove(runId);
            stateService.recordFailure(runId, "executor_rejected");
            throw new IllegalStateException("Export executor rejected run " + runId, e);
        }
        return new ExportRunResponse(
            runId,
            run.status().name(),
            "/api/export/status",
            "/api/export/runs/" + runId + "/artifact"
        );
    }

    /**
     * Asks the active run to stop at the next page boundary. Pages already fetched are kept.
     */
    public ExportStatusResponse requestStop() {
        ExportRunState active = stateService.activeRun();
        if (active != null) {
            stopRequested.set(true);
            log.info("Stop requested for export run {} at page {}", active.runId(), active.currentPage());
        }
        return stateService.snapshot();
    }

    public SearchFilters exportFilters() {
        ProspectorProperties.Export export = properties.getExport();
        return SearchFilters.of(export.getMinEmployees(), export.getMaxEmployees(), export.getFundingStages());
    }

    private ExportRunState beginFresh(int startPage) {
        int safeStart = Math.max(1, startPage);
        synchronized (startLock) {
            ensureNoActiveRun();
            stopRequested.set(false);
            ExportRunState run = stateService.start(safeStart, exportFilters(), null);
            runningRunIds.add(run.runId());
            return run;
        }
    }

    private ExportRunState beginResume() {
        synchronized (startLock) {
            ensureNoActiveRun();
            ExportRunState previous = stateService.latestResumable();
            if (previous == null) {
                throw new NoResumableExportException("No failed export with progress to resume");
            }
            stopRequested.set(false);
            log.info(
                "Resuming export run {} from page {} (last successful page {})",
                previous.runId(),
                previous.resumePage(),
                previous.lastSuccessfulPage()
            );
            ExportRunState run = stateService.start(previous.resumePage(), filtersOf(previous), previous.runId());
            runningRunIds.add(run.runId());
            return run;
        }
    }

    private void ensureNoActiveRun() {
        ExportRunState active = stateService.activeRun();
        if (active != null && isAbandoned(active.runId())) {
            log.warn("Export run {} ended in this process without a final status; marking it failed", active.runId());
            stateService.recordFailure(active.runId(), REASON_ABORTED);
            unfinishedRunIds.remove(active.runId());
            active = stateService.activeRun();
        }
        if (active != null) {
            throw new ExportConflictException(
                active.runId(),
                "Export already in progress (id=" + active.runId() + ", currentPage=" + active.currentPage() + ")"
            );
        }
    }

    private boolean isAbandoned(long runId) {
        return unfinishedRunIds.contains(runId) && !runningRunIds.contains(runId);
    }

    /**
     * Runs the export and guarantees the run leaves PROCESSING: if the loop or its final status
     * write throws, the run is failed here, and a run that cannot even be failed is remembered so
     * the next start can close it.
     */
    private ExportOutcome runWithId(ExportRunState run) {
        long runId = run.runId();
        boolean finished = false;
        try {
            ExportOutcome outcome = execute(run);
            finished = true;
            return outcome;
        } finally {
            if (!finished) {
                abandon(runId);
            }
            runningRunIds.remove(runId);
        }
    }

    private void abandon(long runId) {
        try {
            stateService.recordFailure(runId, REASON_ABORTED);
        } catch (RuntimeException e) {
            unfinishedRunIds.add(runId);
            log.error("Unable to record failure for export run {}; it will be closed on the next start", runId, e);
        }
    }

    private ExportOutcome execute(ExportRunState run) {
        long runId = run.runId();
        SearchFilters filters = filtersOf(run);
        int pageSize = properties.getExport().getPageSize();
        int maxPages = properties.getExport().getMaxPages();
        List<CompanyRecord> collected = new ArrayList<>();
        int page = run.startPage();
        int lastSuccessfulPage = run.startPage() - 1;
        int pagesFetched = 0;
        String failure = null;

        try {
            while (true) {
                if (stopRequested.get()) {
                    failure = REASON_STOPPED;
                    log.info("Export run {} stopped by operator before page {}", runId, page);
                    break;
                }
                if (maxPages > 0 && pagesFetched >= maxPages) {
                    log.info("Export run {} reached the page cap ({} pages)", runId, maxPages);
                    break;
                }

                stateService.markFetching(runId, page);
                log.info("Fetching page {} for export run {}", page, runId);
                CompanyPage result = fetchPage(filters, page, pageSize);
                if (!result.hasCompanies()) {
                    log.info("No more companies found at page {}", page);
                    break;
                }

                stateService.recordPageSuccess(runId, page, result.size());
                collected.addAll(result.companies());
                lastSuccessfulPage = page;
                pagesFetched++;
                log.info("Export run {}: page {} added {} companies (total {})", runId, page, result.size(), collected.size());

                if (result.size() < pageSize) {
                    log.info("Reached last page ({} < {} companies)", result.size(), pageSize);
                    break;
                }
                page++;
                if (!pauseBetweenPages()) {
                    failure = REASON_INTERRUPTED;
                    break;
                }
            }
        } catch (UpstreamException e) {
            failure = e.getReasonCode() + ": " + e.getMessage();
            log.warn(
                "Export run {} failed at page {} after {} page(s): {} (retryable={})",
                runId,
                page,
                pagesFetched,
                failure,
                UpstreamErrorClassifier.isRetryable(e.getReasonCode())
            );
        } catch (RuntimeException e) {
            failure = "unexpected_error: " + e.getMessage();
            log.error("Export run {} failed unexpectedly at page {}", runId, page, e);
        }

        ExportArtifact artifact = null;
        if (!collected.isEmpty()) {
            artifact = artifactWriter.write(runId, collected, run.startPage(), lastSuccessfulPage);
            try {
                stateService.saveArtifact(artifact);
            } catch (DataAccessException e) {
                log.warn("Unable to persist artifact for export run {}; returning it without storage", runId, e);
            }
        }

        ExportRunState finished = failure == null
            ? stateService.complete(runId)
            : stateService.recordFailure(runId, failure);
        log.info(
            "Export run {} finished with status {}: {} companies from {} page(s), last successful page {}",
            runId,
            finished.status(),
            collected.size(),
            pagesFetched,
            finished.lastSuccessfulPage()
        );
        return new ExportOutcome(
            runId,
            finished.status(),
            artifact,
            pagesFetched,
            finished.lastSuccessfulPage(),
            finished.failureReason()
        );
    }

    private CompanyPage fetchPage(SearchFilters filters, int page, int pageSize) {
        return cacheStore.getOrFetch(
            QueryFingerprint.forCompanyPage(filters, page, pageSize),
            properties.getCache().exportTtl(),
            CompanyPage.class,
            () -> dataSource.fetchCompanyPage(filters, page, pageSize)
        );
    }

    private boolean pauseBetweenPages() {
        int delayMs = properties.getExport().getInterPageDelayMs();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private SearchFilters filtersOf(ExportRunState run) {
        if (run.filtersJson() == null || run.filtersJson().isBlank()) {
            return exportFilters();
        }
        try {
            return objectMapper.readValue(run.filtersJson(), SearchFilters.class).normalized();
        } catch (JsonProcessingException e) {
            log.warn("Unreadable filters on export run {}; using configured export filters", run.runId());
            return exportFilters();
        }
    }
}
