package com.tubedigest.feed.service;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.CycleItemResult;
import com.tubedigest.feed.model.CycleRunRequest;
import com.tubedigest.feed.model.CycleRunSummary;
import com.tubedigest.feed.model.ItemOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class DigestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(DigestCliRunner.class);

    private final DigestProperties properties;
    private final FeedOrchestratorService orchestratorService;
    private final ConfigurableApplicationContext applicationContext;

    public DigestCliRunner(
        DigestProperties properties,
        FeedOrchestratorService orchestratorService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.orchestratorService = orchestratorService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        CycleRunSummary summary = orchestratorService.runCycle(new CycleRunRequest(properties.getCli().getQuota(), "cli"));
        log.info(
            "Cycle {} completed with status {}: summarized={} skipped={} deferred={} quotaRemaining={}",
            summary.runId(),
            summary.status(),
            summary.processedCount(),
            summary.skippedCount(),
            summary.deferredCount(),
            summary.quotaRemaining()
        );
        for (CycleItemResult item : summary.items()) {
            if (item.outcome() == ItemOutcome.SUMMARIZED) {
                log.info("Summarized {}: {}", item.videoId(), item.title());
            } else {
                log.info("{} {}: {} ({})", item.outcome(), item.videoId(), item.title(), item.reasonCode());
            }
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
