package com.tubedigest.feed.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tubedigest.feed.http.PoliteHttpClient;
import com.tubedigest.feed.model.HttpFetchResult;
import com.tubedigest.feed.model.Summary;
import com.tubedigest.feed.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat-completions client for OpenAI compatible endpoints (Groq, a local Ollama).
 */
public class OpenAiCompatibleSummarizer implements Summarizer {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleSummarizer.class);
    private static final int MIN_TEXT_LENGTH = 50;
    private static final String SYSTEM_PROMPT =
        "You are a professional news summarizer. Create concise, accurate summaries without including URLs or sources.";

    private final String providerName;
    private final PoliteHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String completionsUrl;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final double temperature;

    public OpenAiCompatibleSummarizer(
        String providerName,
        PoliteHttpClient httpClient,
        ObjectMapper objectMapper,
        String baseUrl,
        String apiKey,
        String model,
        int maxTokens,
        double temperature
    ) {
        this.providerName = providerName;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.completionsUrl = stripTrailingSlash(baseUrl) + "/chat/completions";
        this.apiKey = apiKey;
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    @Override
    public String providerName() {
        return providerName;
    }

    @Override
    public Summary summarize(String title, String text, int maxLines) {
        if (text == null || text.strip().length() < MIN_TEXT_LENGTH) {
            throw SummarizationException.invalidInput("Content too short to summarize");
        }
        String payload = requestBody(title, text, Math.max(1, maxLines));
        Map<String, String> headers = new LinkedHashMap<>();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.put("Authorization", "Bearer " + apiKey.trim());
        }

        log.info("Calling {} model={} for '{}'", providerName, model, title);
        HttpFetchResult result = httpClient.postJson(completionsUrl, payload, headers);
        if (result.isNetworkError()) {
            String reason = ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage());
            throw SummarizationException.unavailable(
                reason,
                !"invalid_url".equals(result.errorCode()),
                providerName + " request failed: " + result.errorMessage()
            );
        }
        int status = result.statusCode();
        if (status == 429) {
            throw SummarizationException.rateLimited(providerName + " rate limited the request");
        }
        if (!result.isSuccessful()) {
            String reason = ReasonCodeClassifier.fromHttpStatus(status);
            throw SummarizationException.unavailable(
                reason,
                ReasonCodeClassifier.isRetryable(reason),
                providerName + " returned HTTP " + status
            );
        }
        String content = extractContent(result.body());
        log.info("Summary generated by {}: {} chars", providerName, content.length());
        return new Summary(title, content);
    }

    private String requestBody(String title, String text, int maxLines) {
        String prompt = "You are a professional news summarizer. Your task is to create a concise, neutral summary.\n\n"
            + "Title: " + title + "\n\n"
            + "Content:\n" + text + "\n\n"
            + "Please provide a summary in exactly " + maxLines + " lines or fewer.\n"
            + "- Use neutral, professional tone\n"
            + "- Preserve technical meaning and important details\n"
            + "- Do NOT mention sources or links\n"
            + "- Do NOT include URLs\n"
            + "- Be concise and clear\n\n"
            + "Summary:";
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("max_tokens", maxTokens);
        root.put("temperature", temperature);
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content", prompt);
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw SummarizationException.invalidInput("Could not encode request: " + e.getOriginalMessage());
        }
    }

    private String extractContent(String body) {
        if (body == null || body.isBlank()) {
            throw SummarizationException.unavailable(ReasonCodeClassifier.PARSING_FAILED, false, "Empty completion payload");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw SummarizationException.unavailable(
                ReasonCodeClassifier.PARSING_FAILED,
                false,
                "Malformed completion payload: " + e.getOriginalMessage()
            );
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw SummarizationException.unavailable(ReasonCodeClassifier.PARSING_FAILED, false, "Completion had no content");
        }
        return content.asText().strip();
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
