package com.tubedigest.feed.service;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.CycleRunRequest;
import com.tubedigest.feed.model.CycleRunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fires a cycle every {@code digest.scheduler.interval-minutes}. A tick that finds a
 * cycle already running is skipped.
 */
@Service
public class CycleSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(CycleSchedulerService.class);

    private final FeedOrchestratorService orchestratorService;
    private final DigestProperties properties;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;

    public CycleSchedulerService(FeedOrchestratorService orchestratorService, DigestProperties properties) {
        this.orchestratorService = orchestratorService;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isScheduled() {
        synchronized (lifecycleLock) {
            return scheduler != null;
        }
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("cycle-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            long intervalMinutes = properties.getScheduler().getIntervalMinutes();
            scheduler.scheduleWithFixedDelay(
                this::tick,
                TimeUnit.SECONDS.toMillis(properties.getScheduler().getInitialDelaySeconds()),
                TimeUnit.MINUTES.toMillis(intervalMinutes),
                TimeUnit.MILLISECONDS
            );
            log.info("Cycle scheduler started (every {} minute(s))", intervalMinutes);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (scheduler == null) {
                return;
            }
            orchestratorService.requestCancel();
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
            log.info("Cycle scheduler stopped");
        }
    }

    void tick() {
        if (orchestratorService.isRunning()) {
            log.info("Skipping scheduled cycle; a cycle is already running");
            return;
        }
        try {
            CycleRunSummary summary = orchestratorService.runCycle(CycleRunRequest.defaults("scheduler"));
            log.info("Scheduled cycle {} finished with status {}", summary.runId(), summary.status());
        } catch (ActiveCycleRunException e) {
            log.info("Skipping scheduled cycle: {}", e.getMessage());
        } catch (Exception e) {
            // Keep the schedule alive; the next tick retries.
            log.warn("Scheduled cycle failed", e);
        }
    }
}
