package com.tubedigest.feed.youtube;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.http.PoliteHttpClient;
import com.tubedigest.feed.model.HttpFetchResult;
import com.tubedigest.feed.model.ResolvedChannel;
import com.tubedigest.feed.util.ReasonCodeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a channel URL or {@code @handle} into the permanent {@code UC...} channel id the
 * feed endpoint expects. Handle and vanity pages are fetched once and the owner id is read
 * from the page source; {@code /channel/UC...} URLs need no request.
 */
@Service
public class YouTubeChannelResolver {
    private static final Logger log = LoggerFactory.getLogger(YouTubeChannelResolver.class);
    private static final Pattern OWNER_ID = Pattern.compile("\"externalId\":\"(UC[a-zA-Z0-9_-]{22})\"");
    private static final Pattern CHANNEL_PATH = Pattern.compile("/channel/(UC[a-zA-Z0-9_-]{22})");
    private static final String ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.5";

    private final PoliteHttpClient httpClient;
    private final DigestProperties properties;

    public YouTubeChannelResolver(PoliteHttpClient httpClient, DigestProperties properties) {
        this.httpClient = httpClient;
        this.properties = properties;
    }

    /**
     * True for URLs and handles. Anything else is taken to be a channel id already.
     */
    public static boolean needsResolution(String channelRef) {
        if (channelRef == null) {
            return false;
        }
        String value = channelRef.trim().toLowerCase(Locale.ROOT);
        return value.startsWith("@")
            || value.startsWith("http://")
            || value.startsWith("https://")
            || value.contains("youtube.com")
            || value.contains("/");
    }

    public String pageUrl(String channelRef) {
        String value = channelRef.trim();
        if (value.startsWith("@")) {
            return stripTrailingSlash(properties.getYoutube().getChannelPageBaseUrl()) + "/" + value;
        }
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return "https://" + value;
        }
        return value;
    }

    public ResolvedChannel resolve(String channelRef) {
        if (channelRef == null || channelRef.isBlank()) {
            throw new ChannelResolutionException("Channel reference is blank", ReasonCodeClassifier.HTTP_400);
        }
        String url = pageUrl(channelRef);
        Matcher direct = CHANNEL_PATH.matcher(url);
        if (direct.find()) {
            return new ResolvedChannel(direct.group(1), null, url);
        }

        HttpFetchResult result = httpClient.get(url, ACCEPT);
        if (result.isNetworkError()) {
            throw new ChannelResolutionException(
                "Could not load " + url + ": " + result.errorMessage(),
                ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage())
            );
        }
        if (!result.isSuccessful()) {
            throw new ChannelResolutionException(
                "Channel page " + url + " returned HTTP " + result.statusCode(),
                ReasonCodeClassifier.fromHttpStatus(result.statusCode())
            );
        }
        String html = result.body() == null ? "" : result.body();
        Matcher owner = OWNER_ID.matcher(html);
        if (!owner.find()) {
            throw new ChannelResolutionException(
                "Owner channel id not found on " + url,
                ReasonCodeClassifier.PARSING_FAILED
            );
        }
        String channelId = owner.group(1);
        String name = channelName(Jsoup.parse(html, url));
        log.info("Resolved {} to channel {} ({})", url, channelId, name);
        return new ResolvedChannel(channelId, name, url);
    }

    private String channelName(Document page) {
        Element ogTitle = page.selectFirst("meta[property=og:title]");
        if (ogTitle != null && !ogTitle.attr("content").isBlank()) {
            return ogTitle.attr("content").trim();
        }
        String title = page.title().trim();
        if (title.endsWith(" - YouTube")) {
            title = title.substring(0, title.length() - " - YouTube".length()).trim();
        }
        return title.isEmpty() ? null : title;
    }

    private static String stripTrailingSlash(String value) {
        String base = value == null ? "https://www.youtube.com" : value.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }
}
