package com.tubedigest.feed.stage;

import com.tubedigest.feed.model.StageResult;
import com.tubedigest.feed.model.TranscriptText;
import com.tubedigest.feed.util.ReasonCodeClassifier;
import com.tubedigest.feed.youtube.TranscriptClient;
import com.tubedigest.feed.youtube.TranscriptFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Wraps the transcript collaborator and folds every outcome into a {@link StageResult}.
 * Missing captions are permanent; network trouble is transient; anything the client
 * marks as permanent is fatal.
 */
@Component
public class TranscriptStage {
    private static final Logger log = LoggerFactory.getLogger(TranscriptStage.class);

    private final TranscriptClient transcriptClient;

    public TranscriptStage(TranscriptClient transcriptClient) {
        this.transcriptClient = transcriptClient;
    }

    public StageResult<TranscriptText> fetch(String videoId) {
        try {
            Optional<TranscriptText> transcript = transcriptClient.fetch(videoId);
            if (transcript.isEmpty() || transcript.get().cleanText() == null || transcript.get().cleanText().isBlank()) {
                return StageResult.unavailable(ReasonCodeClassifier.NO_TRANSCRIPT, "No transcript available for " + videoId);
            }
            return StageResult.success(transcript.get());
        } catch (TranscriptFetchException e) {
            String reason = e.getReasonCode() == null ? ReasonCodeClassifier.UNKNOWN : e.getReasonCode();
            if (e.isTransient()) {
                log.info("Transient transcript failure for {}: {}", videoId, e.getMessage());
                return StageResult.transientFailure(reason, e.getMessage());
            }
            log.warn("Transcript fetch failed permanently for {}: {}", videoId, e.getMessage());
            return StageResult.fatal(ReasonCodeClassifier.TRANSCRIPT_FAILED, reason + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected transcript failure for {}", videoId, e);
            return StageResult.transientFailure(
                ReasonCodeClassifier.UNKNOWN,
                e.getClass().getSimpleName() + ": " + e.getMessage()
            );
        }
    }
}
