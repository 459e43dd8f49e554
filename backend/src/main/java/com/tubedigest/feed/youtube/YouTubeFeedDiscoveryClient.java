package com.tubedigest.feed.youtube;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.http.PoliteHttpClient;
import com.tubedigest.feed.model.DiscoveredVideo;
import com.tubedigest.feed.model.HttpFetchResult;
import com.tubedigest.feed.util.ReasonCodeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the public Atom feed YouTube publishes for every channel. No API key is needed;
 * the feed only lists the most recent uploads, which is enough for periodic polling.
 */
@Service
public class YouTubeFeedDiscoveryClient implements VideoDiscoveryClient {
    private static final Logger log = LoggerFactory.getLogger(YouTubeFeedDiscoveryClient.class);
    private static final String ACCEPT = "application/atom+xml,application/xml;q=0.9,*/*;q=0.5";

    private final PoliteHttpClient httpClient;
    private final DigestProperties properties;

    public YouTubeFeedDiscoveryClient(PoliteHttpClient httpClient, DigestProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    @Override
    public List<DiscoveredVideo> discover(String channelRef, Instant since) {
        if (channelRef == null || channelRef.isBlank()) {
            throw new DiscoveryException("Channel reference is blank", ReasonCodeClassifier.HTTP_400, false);
        }
        String url = feedUrl(channelRef.trim());
        HttpFetchResult result = httpClient.getOnce(url, ACCEPT);
        if (result.isNetworkError()) {
            String reason = ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage());
            throw new DiscoveryException(
                "Feed fetch failed for " + channelRef + ": " + result.errorMessage(),
                reason,
                !"invalid_url".equals(result.errorCode())
            );
        }
        if (!result.isSuccessful()) {
            String reason = ReasonCodeClassifier.fromHttpStatus(result.statusCode());
            throw new DiscoveryException(
                "Feed fetch returned HTTP " + result.statusCode() + " for " + channelRef,
                reason,
                ReasonCodeClassifier.isRetryable(reason)
            );
        }
        if (result.body() == null || result.body().isBlank()) {
            throw new DiscoveryException("Empty feed payload for " + channelRef, ReasonCodeClassifier.PARSING_FAILED, false);
        }
        List<DiscoveredVideo> videos = parseFeed(result.body(), since);
        log.info("Feed {} listed {} video(s) after {}", channelRef, videos.size(), since);
        return videos;
    }

    List<DiscoveredVideo> parseFeed(String xmlPayload, Instant since) {
        Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
        List<Element> entries = xml.getElementsByTag("entry");
        if (entries.isEmpty() && xml.getElementsByTag("feed").isEmpty()) {
            throw new DiscoveryException("Payload is not an Atom feed", ReasonCodeClassifier.PARSING_FAILED, false);
        }
        List<DiscoveredVideo> videos = new ArrayList<>();
        for (Element entry : entries) {
            Instant publishedAt = parseInstant(childText(entry, "published"));
            if (publishedAt == null) {
                log.debug("Skipping feed entry without a parsable published date");
                continue;
            }
            if (since != null && !publishedAt.isAfter(since)) {
                continue;
            }
            String link = alternateLink(entry);
            String videoId = childText(entry, "yt:videoId");
            if (videoId == null) {
                videoId = videoIdFromLink(link);
            }
            if (videoId == null) {
                log.debug("Skipping feed entry without a video id");
                continue;
            }
            String title = childText(entry, "title");
            if (link == null) {
                link = "https://www.youtube.com/watch?v=" + videoId;
            }
            videos.add(new DiscoveredVideo(videoId, title == null ? "Untitled" : title, publishedAt, link));
        }
        return videos;
    }

    private String feedUrl(String channelRef) {
        String base = properties.getYoutube().getFeedBaseUrl();
        String separator = base.contains("?") ? "&" : "?";
        return base + separator + "channel_id=" + URLEncoder.encode(channelRef, StandardCharsets.UTF_8);
    }

    private String childText(Element parent, String tagName) {
        for (Element child : parent.children()) {
            if (child.tagName().equalsIgnoreCase(tagName)) {
                String text = child.text().trim();
                return text.isEmpty() ? null : text;
            }
        }
        return null;
    }

    private String alternateLink(Element entry) {
        String fallback = null;
        for (Element child : entry.children()) {
            if (!child.tagName().equalsIgnoreCase("link")) {
                continue;
            }
            String href = child.attr("href").trim();
            if (href.isEmpty()) {
                continue;
            }
            String rel = child.attr("rel");
            if (rel.isEmpty() || "alternate".equalsIgnoreCase(rel)) {
                return href;
            }
            if (fallback == null) {
                fallback = href;
            }
        }
        return fallback;
    }

    static String videoIdFromLink(String link) {
        if (link == null) {
            return null;
        }
        int idx = link.indexOf("watch?v=");
        if (idx < 0) {
            return null;
        }
        String tail = link.substring(idx + "watch?v=".length());
        int end = tail.indexOf('&');
        String id = end < 0 ? tail : tail.substring(0, end);
        return id.isBlank() ? null : id;
    }

    static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim()).toInstant();
        } catch (DateTimeParseException ignored) {
            // Some feeds use a bare UTC instant.
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }
}
