package com.tubedigest.feed.llm;

import com.tubedigest.feed.model.Summary;

/**
 * One summarization capability; providers differ only in endpoint, credentials and model.
 */
public interface Summarizer {

    /**
     * @throws SummarizationException with kind {@code RATE_LIMITED}, {@code INVALID_INPUT} or {@code UNAVAILABLE}
     */
    Summary summarize(String title, String text, int maxLines);

    String providerName();
}
