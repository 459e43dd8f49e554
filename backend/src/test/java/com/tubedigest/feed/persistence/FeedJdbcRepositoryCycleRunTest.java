package com.tubedigest.feed.persistence;

import com.tubedigest.feed.model.CycleRunMeta;
import com.tubedigest.feed.service.CycleRunLifecycleRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class FeedJdbcRepositoryCycleRunTest {

    @Autowired
    private FeedJdbcRepository repository;

    @Autowired
    private CycleRunLifecycleRunner lifecycleRunner;

    @Test
    void completedRunKeepsCountsAndStatus() {
        Instant startedAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        long runId = repository.insertCycleRun(startedAt, "RUNNING", "manual", 5, "cycle started");

        repository.completeCycleRun(runId, startedAt.plusSeconds(30), "COMPLETED", 3, 1, 1, "discovered=5");

        CycleRunMeta run = repository.findCycleRun(runId);
        assertThat(run.status()).isEqualTo("COMPLETED");
        assertThat(run.trigger()).isEqualTo("manual");
        assertThat(run.quota()).isEqualTo(5);
        assertThat(run.processedCount()).isEqualTo(3);
        assertThat(run.skippedCount()).isEqualTo(1);
        assertThat(run.deferredCount()).isEqualTo(1);
        assertThat(run.finishedAt()).isEqualTo(startedAt.plusSeconds(30));
        assertThat(repository.findRecentCycleRuns(5)).extracting(CycleRunMeta::runId).contains(runId);
        assertThat(repository.findRunningCycleRuns()).extracting(CycleRunMeta::runId).doesNotContain(runId);
    }

    @Test
    void startupCleanupAbortsOnlyStaleRunningRows() {
        long stale = repository.insertCycleRun(Instant.now().minus(Duration.ofHours(5)), "RUNNING", "cli", 5, "cycle started");
        long fresh = repository.insertCycleRun(Instant.now(), "RUNNING", "cli", 5, "cycle started");

        lifecycleRunner.run(null);

        assertThat(repository.findCycleRun(stale).status()).isEqualTo("ABORTED");
        assertThat(repository.findCycleRun(fresh).status()).isEqualTo("RUNNING");
    }

    @Test
    void tableCountsCoverEveryTable() {
        Map<String, Long> counts = repository.tableCounts();

        assertThat(counts).containsOnlyKeys("sources", "processed_videos", "cycle_runs");
        assertThat(repository.isDbReachable()).isTrue();
    }
}
