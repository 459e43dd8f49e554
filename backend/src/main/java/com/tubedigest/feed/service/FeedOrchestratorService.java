package com.tubedigest.feed.service;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.CycleError;
import com.tubedigest.feed.model.CycleItemResult;
import com.tubedigest.feed.model.CycleRunRequest;
import com.tubedigest.feed.model.CycleRunSummary;
import com.tubedigest.feed.model.CycleState;
import com.tubedigest.feed.model.DiscoveredVideo;
import com.tubedigest.feed.model.ErrorCategory;
import com.tubedigest.feed.model.ItemOutcome;
import com.tubedigest.feed.model.ProcessedRecord;
import com.tubedigest.feed.model.Source;
import com.tubedigest.feed.model.StageKind;
import com.tubedigest.feed.model.StageResult;
import com.tubedigest.feed.model.StageStatus;
import com.tubedigest.feed.model.Summary;
import com.tubedigest.feed.model.TranscriptText;
import com.tubedigest.feed.model.VideoCandidate;
import com.tubedigest.feed.persistence.FeedJdbcRepository;
import com.tubedigest.feed.stage.SummarizationStage;
import com.tubedigest.feed.stage.TranscriptStage;
import com.tubedigest.feed.util.ReasonCodeClassifier;
import com.tubedigest.feed.youtube.DiscoveryException;
import com.tubedigest.feed.youtube.VideoDiscoveryClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one polling cycle: discover per source, select oldest first under the quota,
 * push each candidate through transcript and summarization, then advance watermarks.
 * <p>
 * Only one cycle runs at a time and candidates are processed strictly one after the
 * other; the governor's pacing depends on that. Per-item failures end up in the
 * returned summary. Database failures and unexpected errors abort a run: its row is
 * marked FAILED and no watermark advances.
 */
@Service
public class FeedOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(FeedOrchestratorService.class);

    private final SourceRegistry sourceRegistry;
    private final DedupLedger dedupLedger;
    private final RateGovernor rateGovernor;
    private final VideoDiscoveryClient discoveryClient;
    private final TranscriptStage transcriptStage;
    private final SummarizationStage summarizationStage;
    private final FeedJdbcRepository repository;
    private final DigestService digestService;
    private final DigestProperties properties;
    private final ReentrantLock runLock = new ReentrantLock();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile CycleState state = CycleState.IDLE;

    public FeedOrchestratorService(
        SourceRegistry sourceRegistry,
        DedupLedger dedupLedger,
        RateGovernor rateGovernor,
        VideoDiscoveryClient discoveryClient,
        TranscriptStage transcriptStage,
        SummarizationStage summarizationStage,
        FeedJdbcRepository repository,
        DigestService digestService,
        DigestProperties properties
    ) {
        this.sourceRegistry = sourceRegistry;
        this.dedupLedger = dedupLedger;
        this.rateGovernor = rateGovernor;
        this.discoveryClient = discoveryClient;
        this.transcriptStage = transcriptStage;
        this.summarizationStage = summarizationStage;
        this.repository = repository;
        this.digestService = digestService;
        this.properties = properties;
    }

    public CycleRunSummary runCycle(CycleRunRequest request) {
        if (!runLock.tryLock()) {
            throw new ActiveCycleRunException("A cycle is already running (state=" + state + ")");
        }
        try {
            cancelRequested.set(false);
            CycleRunSummary summary = execute(request == null ? CycleRunRequest.defaults(null) : request);
            publishDigest(summary);
            return summary;
        } finally {
            state = CycleState.IDLE;
            cancelRequested.set(false);
            runLock.unlock();
        }
    }

    /**
     * Asks the running cycle to stop before its next candidate. Returns false when no
     * cycle is running.
     */
    public boolean requestCancel() {
        if (!runLock.isLocked()) {
            return false;
        }
        cancelRequested.set(true);
        log.info("Cancellation requested for the running cycle");
        return true;
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    public CycleState currentState() {
        return state;
    }

    private CycleRunSummary execute(CycleRunRequest request) {
        Instant startedAt = Instant.now();
        int quota = request.quota() == null ? properties.getRun().getDefaultQuota() : Math.max(0, request.quota());
        long runId;
        try {
            runId = repository.insertCycleRun(startedAt, "RUNNING", request.normalizedTrigger(), quota, "cycle started");
        } catch (DataAccessException e) {
            throw new CyclePersistenceException(0L, "Could not record cycle start", e);
        }
        log.info("Cycle {} started (trigger={}, quota={})", runId, request.normalizedTrigger(), quota);

        CycleContext ctx = new CycleContext(runId);
        try {
            state = CycleState.DISCOVERING;
            List<Source> sources = sourceRegistry.listActiveSources();
            if (sources.isEmpty()) {
                rateGovernor.startRun(quota);
                return finish(ctx, startedAt, quota, "NO_SOURCES", Map.of());
            }
            Map<Long, Integer> registrationOrder = new HashMap<>();
            for (int i = 0; i < sources.size(); i++) {
                registrationOrder.put(sources.get(i).sourceId(), i);
            }
            List<VideoCandidate> discovered = discover(sources, ctx);

            state = CycleState.SELECTING;
            rateGovernor.startRun(quota);
            List<VideoCandidate> sorted = new ArrayList<>(discovered);
            sorted.sort(
                Comparator.comparing(VideoCandidate::publishedAt)
                    .thenComparing(c -> registrationOrder.getOrDefault(c.sourceId(), Integer.MAX_VALUE))
                    .thenComparing(VideoCandidate::videoId)
            );
            int granted = rateGovernor.reserve(sorted.size());
            List<VideoCandidate> selected = sorted.subList(0, granted);
            for (VideoCandidate leftOver : sorted.subList(granted, sorted.size())) {
                ctx.markUnresolved(leftOver);
            }
            ctx.discoveredCount = sorted.size();
            ctx.selectedCount = granted;
            log.info("Cycle {} selected {} of {} candidate(s)", runId, granted, sorted.size());

            state = CycleState.PROCESSING;
            for (VideoCandidate candidate : selected) {
                if (ctx.cancelled || cancelRequested.get()) {
                    ctx.cancelled = true;
                    ctx.defer(candidate, ReasonCodeClassifier.CANCELLED, "Cycle cancelled before processing", false);
                    continue;
                }
                process(candidate, ctx);
            }

            state = CycleState.FINALIZING;
            Map<Long, Instant> targets = ctx.watermarkTargets();
            String status;
            if (ctx.cancelled) {
                status = "CANCELLED";
            } else if (ctx.errors.isEmpty()) {
                status = "COMPLETED";
            } else {
                status = "COMPLETED_WITH_ERRORS";
            }
            return finish(ctx, startedAt, quota, status, targets);
        } catch (DataAccessException | SourceNotFoundException e) {
            log.warn("Cycle {} aborted on persistence failure", runId, e);
            markFailed(ctx, e);
            throw new CyclePersistenceException(runId, "Cycle " + runId + " aborted: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("Cycle {} aborted on unexpected failure", runId, e);
            markFailed(ctx, e);
            throw e;
        }
    }

    private void markFailed(CycleContext ctx, RuntimeException cause) {
        try {
            repository.completeCycleRun(
                ctx.runId,
                Instant.now(),
                "FAILED",
                ctx.processedCount,
                ctx.skippedCount,
                ctx.deferredCount,
                "exception=" + cause.getClass().getSimpleName()
            );
        } catch (DataAccessException closeError) {
            log.warn("Could not mark cycle {} as failed", ctx.runId, closeError);
        }
    }

    private List<VideoCandidate> discover(List<Source> sources, CycleContext ctx) {
        List<VideoCandidate> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Source source : sources) {
            if (!rateGovernor.acquire(StageKind.DISCOVERY)) {
                ctx.cancelled = true;
                ctx.errors.add(new CycleError(
                    source.sourceId(), null, ErrorCategory.TRANSIENT_NETWORK, ReasonCodeClassifier.INTERRUPTED,
                    "Discovery interrupted"
                ));
                break;
            }
            Instant watermark = source.watermark();
            List<DiscoveredVideo> found;
            try {
                found = discoveryClient.discover(source.channelRef(), watermark);
                rateGovernor.recordSuccess(StageKind.DISCOVERY);
            } catch (DiscoveryException e) {
                if (e.isTransient()) {
                    rateGovernor.recordThrottled(StageKind.DISCOVERY);
                } else {
                    rateGovernor.recordSuccess(StageKind.DISCOVERY);
                }
                log.warn("Discovery failed for source {} ({}): {}", source.sourceId(), source.channelRef(), e.getMessage());
                ctx.errors.add(new CycleError(
                    source.sourceId(),
                    null,
                    ReasonCodeClassifier.categoryOf(e.getReasonCode()),
                    e.getReasonCode(),
                    e.getMessage()
                ));
                continue;
            } catch (RuntimeException e) {
                log.warn("Discovery failed for source {} ({})", source.sourceId(), source.channelRef(), e);
                ctx.errors.add(new CycleError(
                    source.sourceId(), null, ErrorCategory.TRANSIENT_NETWORK, ReasonCodeClassifier.DISCOVERY_FAILED,
                    e.getClass().getSimpleName() + ": " + e.getMessage()
                ));
                continue;
            }

            int kept = 0;
            for (DiscoveredVideo video : found == null ? List.<DiscoveredVideo>of() : found) {
                if (video == null || video.videoId() == null || video.publishedAt() == null) {
                    continue;
                }
                if (watermark != null && !video.publishedAt().isAfter(watermark)) {
                    continue;
                }
                if (seen.contains(video.videoId()) || dedupLedger.hasProcessed(video.videoId())) {
                    continue;
                }
                seen.add(video.videoId());
                candidates.add(VideoCandidate.from(video, source.sourceId()));
                kept++;
            }
            log.info("Source {} ({}): {} new candidate(s)", source.sourceId(), source.channelRef(), kept);
        }
        return candidates;
    }

    private void process(VideoCandidate candidate, CycleContext ctx) {
        if (!rateGovernor.acquire(StageKind.TRANSCRIPT)) {
            ctx.cancelled = true;
            ctx.defer(candidate, ReasonCodeClassifier.INTERRUPTED, "Interrupted while waiting for the transcript slot", true);
            return;
        }
        StageResult<TranscriptText> transcript = transcriptStage.fetch(candidate.videoId());
        if (transcript.status() == StageStatus.TRANSIENT) {
            rateGovernor.recordThrottled(StageKind.TRANSCRIPT);
            ctx.defer(candidate, transcript.reasonCode(), transcript.message(), true);
            return;
        }
        rateGovernor.recordSuccess(StageKind.TRANSCRIPT);
        if (transcript.status() == StageStatus.UNAVAILABLE) {
            ctx.skip(candidate, ReasonCodeClassifier.NO_TRANSCRIPT, transcript.message(), false);
            return;
        }
        if (transcript.status() == StageStatus.FATAL) {
            ctx.skip(candidate, ReasonCodeClassifier.TRANSCRIPT_FAILED, transcript.message(), true);
            return;
        }

        int maxAttempts = 1 + properties.getRun().getSummarizeMaxRetries();
        int maxLines = properties.getRun().getMaxSummaryLines();
        StageResult<Summary> summary = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!rateGovernor.acquire(StageKind.SUMMARIZE)) {
                ctx.cancelled = true;
                ctx.defer(candidate, ReasonCodeClassifier.INTERRUPTED, "Interrupted while waiting for the summarizer slot", true);
                return;
            }
            summary = summarizationStage.summarize(candidate.title(), transcript.value().cleanText(), maxLines);
            if (summary.status() != StageStatus.TRANSIENT) {
                rateGovernor.recordSuccess(StageKind.SUMMARIZE);
                break;
            }
            rateGovernor.recordThrottled(StageKind.SUMMARIZE);
            log.info(
                "Summarize attempt {}/{} for {} was throttled ({})",
                attempt,
                maxAttempts,
                candidate.videoId(),
                summary.reasonCode()
            );
        }

        if (summary.status() == StageStatus.TRANSIENT) {
            ctx.errors.add(new CycleError(
                candidate.sourceId(),
                candidate.videoId(),
                ReasonCodeClassifier.categoryOf(summary.reasonCode()),
                ReasonCodeClassifier.RETRY_BUDGET_EXHAUSTED,
                summary.message()
            ));
            ctx.defer(candidate, ReasonCodeClassifier.RETRY_BUDGET_EXHAUSTED, summary.message(), false);
            return;
        }
        if (!summary.isSuccess()) {
            ctx.skip(candidate, ReasonCodeClassifier.SUMMARIZATION_FAILED, summary.message(), true);
            return;
        }
        ctx.summarized(candidate, summary.value().text());
    }

    private CycleRunSummary finish(
        CycleContext ctx,
        Instant startedAt,
        int quota,
        String status,
        Map<Long, Instant> advanced
    ) {
        Instant finishedAt = Instant.now();
        String notes = "discovered=" + ctx.discoveredCount
            + " selected=" + ctx.selectedCount
            + " errors=" + ctx.errors.size();
        repository.completeCycleRun(
            ctx.runId,
            finishedAt,
            status,
            ctx.processedCount,
            ctx.skippedCount,
            ctx.deferredCount,
            notes
        );
        // The run row is final before any watermark moves; advancing is one transaction.
        if (!advanced.isEmpty()) {
            sourceRegistry.advanceWatermarks(advanced);
        }
        log.info(
            "Cycle {} finished with status {}: summarized={} skipped={} deferred={} errors={}",
            ctx.runId,
            status,
            ctx.processedCount,
            ctx.skippedCount,
            ctx.deferredCount,
            ctx.errors.size()
        );
        return new CycleRunSummary(
            ctx.runId,
            startedAt,
            finishedAt,
            status,
            quota,
            rateGovernor.quotaRemaining(),
            ctx.discoveredCount,
            ctx.selectedCount,
            ctx.processedCount,
            ctx.skippedCount,
            ctx.deferredCount,
            ctx.cancelled,
            List.copyOf(ctx.items),
            List.copyOf(ctx.errors),
            Map.copyOf(advanced)
        );
    }

    private void publishDigest(CycleRunSummary summary) {
        if (summary.processedCount() == 0) {
            return;
        }
        try {
            digestService.publishRun(summary.runId());
        } catch (RuntimeException e) {
            log.warn("Digest output failed for cycle {}", summary.runId(), e);
        }
    }

    /**
     * Per-run bookkeeping. Watermark targets are derived from two per-source bounds: the
     * newest terminal publish time and the oldest unresolved one.
     */
    private final class CycleContext {
        private final long runId;
        private final List<CycleItemResult> items = new ArrayList<>();
        private final List<CycleError> errors = new ArrayList<>();
        private final Map<Long, List<Instant>> terminalBySource = new LinkedHashMap<>();
        private final Map<Long, Instant> oldestUnresolvedBySource = new HashMap<>();
        private int discoveredCount;
        private int selectedCount;
        private int processedCount;
        private int skippedCount;
        private int deferredCount;
        private boolean cancelled;

        private CycleContext(long runId) {
            this.runId = runId;
        }

        void summarized(VideoCandidate candidate, String summaryText) {
            record(ProcessedRecord.summarized(candidate, runId, summaryText, Instant.now()));
            processedCount++;
            items.add(item(candidate, ItemOutcome.SUMMARIZED, null, null));
        }

        void skip(VideoCandidate candidate, String reasonCode, String message, boolean reportError) {
            record(ProcessedRecord.skipped(candidate, runId, reasonCode, Instant.now()));
            skippedCount++;
            items.add(item(candidate, ItemOutcome.SKIPPED, reasonCode, message));
            if (reportError) {
                errors.add(new CycleError(
                    candidate.sourceId(), candidate.videoId(), ErrorCategory.CONTENT_UNAVAILABLE, reasonCode, message
                ));
            }
            log.info("Skipped {} ({}): {}", candidate.videoId(), reasonCode, message);
        }

        void defer(VideoCandidate candidate, String reasonCode, String message, boolean reportError) {
            markUnresolved(candidate);
            deferredCount++;
            items.add(item(candidate, ItemOutcome.DEFERRED, reasonCode, message));
            if (reportError) {
                errors.add(new CycleError(
                    candidate.sourceId(),
                    candidate.videoId(),
                    ReasonCodeClassifier.categoryOf(reasonCode),
                    reasonCode,
                    message
                ));
            }
            log.info("Deferred {} ({}): {}", candidate.videoId(), reasonCode, message);
        }

        void markUnresolved(VideoCandidate candidate) {
            oldestUnresolvedBySource.merge(
                candidate.sourceId(),
                candidate.publishedAt(),
                (current, next) -> next.isBefore(current) ? next : current
            );
        }

        private void record(ProcessedRecord record) {
            try {
                dedupLedger.markProcessed(record);
            } catch (DuplicateVideoException e) {
                log.info("Video {} was already recorded by another writer", record.videoId());
            }
            terminalBySource.computeIfAbsent(record.sourceId(), id -> new ArrayList<>()).add(record.publishedAt());
        }

        /**
         * Newest terminal publish time per source that is strictly older than every
         * unresolved candidate of the same source.
         */
        Map<Long, Instant> watermarkTargets() {
            Map<Long, Instant> targets = new LinkedHashMap<>();
            for (Map.Entry<Long, List<Instant>> entry : terminalBySource.entrySet()) {
                Instant ceiling = oldestUnresolvedBySource.get(entry.getKey());
                Instant best = null;
                for (Instant publishedAt : entry.getValue()) {
                    if (ceiling != null && !publishedAt.isBefore(ceiling)) {
                        continue;
                    }
                    if (best == null || publishedAt.isAfter(best)) {
                        best = publishedAt;
                    }
                }
                if (best != null) {
                    targets.put(entry.getKey(), best);
                }
            }
            return targets;
        }

        private CycleItemResult item(VideoCandidate candidate, ItemOutcome outcome, String reasonCode, String message) {
            return new CycleItemResult(
                candidate.videoId(),
                candidate.sourceId(),
                candidate.title(),
                candidate.publishedAt(),
                outcome,
                reasonCode,
                message
            );
        }
    }
}
