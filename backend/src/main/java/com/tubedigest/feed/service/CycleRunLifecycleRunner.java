package com.tubedigest.feed.service;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.CycleRunMeta;
import com.tubedigest.feed.persistence.FeedJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Closes out cycle rows a crashed process left in RUNNING.
 */
@Component
@Order(0)
public class CycleRunLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(CycleRunLifecycleRunner.class);

    private final FeedJdbcRepository repository;
    private final FeedOrchestratorService orchestratorService;
    private final DigestProperties properties;

    public CycleRunLifecycleRunner(
        FeedJdbcRepository repository,
        FeedOrchestratorService orchestratorService,
        DigestProperties properties
    ) {
        this.repository = repository;
        this.orchestratorService = orchestratorService;
        this.properties = properties;
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
            log.warn("Skipping cycle run cleanup because database is unreachable");
            return;
        }
        if (orchestratorService.isRunning()) {
            return;
        }

        Instant cutoff = Instant.now().minus(Duration.ofMinutes(properties.getStaleRunMinutes()));
        List<CycleRunMeta> running = repository.findRunningCycleRuns();
        for (CycleRunMeta run : running) {
            if (run.startedAt().isAfter(cutoff)) {
                continue;
            }
            repository.completeCycleRun(
                run.runId(),
                Instant.now(),
                "ABORTED",
                run.processedCount(),
                run.skippedCount(),
                run.deferredCount(),
                "aborted_on_startup"
            );
            log.info("Aborted stale cycle run {} startedAt={}", run.runId(), run.startedAt());
        }
    }
}
