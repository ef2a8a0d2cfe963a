package com.delta.prospector.company.service;

import com.delta.prospector.company.cache.QueryCacheStore;
import com.delta.prospector.company.model.ExportRunState;
import com.delta.prospector.company.persistence.ExportRunRepository;
import com.delta.prospector.config.ProspectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Startup cleanup: exports left PROCESSING by a previous process can never finish, so they are
 * failed with their progress intact and become resumable. Expired cache rows are purged.
 */
@Component
@Order(0)
public class ExportRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ExportRunLifecycleRunner.class);

    static final String INTERRUPTED_REASON = "interrupted_by_restart";

    private final ExportRunRepository repository;
    private final ExportStateService stateService;
    private final QueryCacheStore cacheStore;
    private final ProspectorProperties properties;
    private final Clock clock;

    public ExportRunLifecycleRunner(
        ExportRunRepository repository,
        ExportStateService stateService,
        QueryCacheStore cacheStore,
        ProspectorProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.stateService = stateService;
        this.cacheStore = cacheStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping export run cleanup because database is unreachable");
            return;
        }

        Instant cutoff = clock.instant().minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        for (ExportRunState run : stateService.processingRuns()) {
            Instant lastUpdate = run.updatedAt() == null ? run.createdAt() : run.updatedAt();
            if (lastUpdate != null && lastUpdate.isAfter(cutoff)) {
                continue;
            }
            stateService.recordFailure(run.runId(), INTERRUPTED_REASON);
            log.info(
                "Marked stale export run {} as FAILED (last successful page {}, updatedAt={})",
                run.runId(),
                run.lastSuccessfulPage(),
                lastUpdate
            );
        }

        cacheStore.purgeExpired();
    }
}
