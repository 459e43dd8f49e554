package com.tubedigest.feed.stage;

import com.tubedigest.feed.llm.SummarizationException;
import com.tubedigest.feed.llm.Summarizer;
import com.tubedigest.feed.model.StageResult;
import com.tubedigest.feed.model.Summary;
import com.tubedigest.feed.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SummarizationStage {
    private static final Logger log = LoggerFactory.getLogger(SummarizationStage.class);

    private final Summarizer summarizer;

    public SummarizationStage(Summarizer summarizer) {
        this.summarizer = summarizer;
    }

    public StageResult<Summary> summarize(String title, String text, int maxLines) {
        try {
            Summary summary = summarizer.summarize(title, text, maxLines);
            if (summary == null || summary.text() == null || summary.text().isBlank()) {
                return StageResult.fatal(ReasonCodeClassifier.SUMMARIZATION_FAILED, "Summarizer returned an empty summary");
            }
            return StageResult.success(summary);
        } catch (SummarizationException e) {
            // Rate limits and retryable outages go back through the governor.
            if (e.getKind() == SummarizationException.Kind.RATE_LIMITED || e.isRetryable()) {
                log.info("Transient {} failure for '{}': {}", summarizer.providerName(), title, e.getMessage());
                return StageResult.transientFailure(e.getReasonCode(), e.getMessage());
            }
            log.warn("Summarization failed for '{}' ({}): {}", title, e.getReasonCode(), e.getMessage());
            return StageResult.fatal(ReasonCodeClassifier.SUMMARIZATION_FAILED, e.getReasonCode() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected {} failure for '{}'", summarizer.providerName(), title, e);
            return StageResult.transientFailure(
                ReasonCodeClassifier.UNKNOWN,
                e.getClass().getSimpleName() + ": " + e.getMessage()
            );
        }
    }
}
