package com.tubedigest.feed.youtube;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.http.PoliteHttpClient;
import com.tubedigest.feed.model.HttpFetchResult;
import com.tubedigest.feed.model.StageKind;
import com.tubedigest.feed.model.TranscriptText;
import com.tubedigest.feed.service.RateGovernor;
import com.tubedigest.feed.util.ReasonCodeClassifier;
import com.tubedigest.feed.util.TranscriptTextCleaner;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Fetches the timed-text caption track of a video, trying each configured language in order.
 * The caller holds the transcript slot for the first language; every further language
 * waits for its own slot.
 */
@Service
public class TimedTextTranscriptClient implements TranscriptClient {
    private static final Logger log = LoggerFactory.getLogger(TimedTextTranscriptClient.class);

    private final PoliteHttpClient httpClient;
    private final DigestProperties properties;
    private final RateGovernor rateGovernor;

    public TimedTextTranscriptClient(PoliteHttpClient httpClient, DigestProperties properties, RateGovernor rateGovernor) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.rateGovernor = rateGovernor;
    }

    @Override
    public Optional<TranscriptText> fetch(String videoId) {
        if (videoId == null || videoId.isBlank()) {
            throw new TranscriptFetchException("Video id is blank", ReasonCodeClassifier.HTTP_400, false);
        }
        boolean firstRequest = true;
        for (String language : properties.getYoutube().getTranscriptLanguages()) {
            if (!firstRequest && !rateGovernor.acquire(StageKind.TRANSCRIPT)) {
                throw new TranscriptFetchException(
                    "Interrupted while waiting to fetch captions for " + videoId,
                    ReasonCodeClassifier.INTERRUPTED,
                    true
                );
            }
            firstRequest = false;
            HttpFetchResult result = httpClient.getOnce(trackUrl(videoId, language), "text/xml,application/xml;q=0.9,*/*;q=0.5");
            if (result.isNetworkError()) {
                String reason = ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage());
                throw new TranscriptFetchException(
                    "Caption fetch failed for " + videoId + ": " + result.errorMessage(),
                    reason,
                    !"invalid_url".equals(result.errorCode())
                );
            }
            int status = result.statusCode();
            if (status == 404) {
                continue;
            }
            if (!result.isSuccessful()) {
                String reason = ReasonCodeClassifier.fromHttpStatus(status);
                throw new TranscriptFetchException(
                    "Caption fetch returned HTTP " + status + " for " + videoId,
                    reason,
                    ReasonCodeClassifier.isRetryable(reason)
                );
            }
            String text = extractText(result.body());
            if (!text.isEmpty()) {
                log.info("Transcript for {} ({}): {} characters", videoId, language, text.length());
                return Optional.of(new TranscriptText(videoId, language, text));
            }
        }
        log.info("No captions available for {}", videoId);
        return Optional.empty();
    }

    String extractText(String xmlPayload) {
        if (xmlPayload == null || xmlPayload.isBlank()) {
            return "";
        }
        Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
        StringJoiner joiner = new StringJoiner(" ");
        for (Element line : xml.getElementsByTag("text")) {
            String value = line.text();
            if (!value.isBlank()) {
                joiner.add(value);
            }
        }
        return TranscriptTextCleaner.clean(joiner.toString());
    }

    private String trackUrl(String videoId, String language) {
        String base = properties.getYoutube().getTranscriptBaseUrl();
        String separator = base.contains("?") ? "&" : "?";
        return base + separator
            + "v=" + URLEncoder.encode(videoId.trim(), StandardCharsets.UTF_8)
            + "&lang=" + URLEncoder.encode(language, StandardCharsets.UTF_8);
    }
}
