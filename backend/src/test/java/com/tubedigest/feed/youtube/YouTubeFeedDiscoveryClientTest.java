package com.tubedigest.feed.youtube;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.http.PoliteHttpClient;
import com.tubedigest.feed.model.DiscoveredVideo;
import com.tubedigest.feed.util.ReasonCodeClassifier;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YouTubeFeedDiscoveryClientTest {
    private static final String FEED = """
        <?xml version="1.0" encoding="UTF-8"?>
        <feed xmlns:yt="http://www.youtube.com/xml/schemas/2015" xmlns="http://www.w3.org/2005/Atom">
          <title>Example Channel</title>
          <entry>
            <id>yt:video:vid-new</id>
            <yt:videoId>vid-new</yt:videoId>
            <title>Newest upload</title>
            <link rel="alternate" href="https://www.youtube.com/watch?v=vid-new"/>
            <published>2024-05-03T10:00:00+00:00</published>
          </entry>
          <entry>
            <id>yt:video:vid-mid</id>
            <title>Middle upload &amp; more</title>
            <link rel="alternate" href="https://www.youtube.com/watch?v=vid-mid&amp;t=3"/>
            <published>2024-05-02T10:00:00+00:00</published>
          </entry>
          <entry>
            <id>yt:video:vid-old</id>
            <yt:videoId>vid-old</yt:videoId>
            <title>Old upload</title>
            <link rel="alternate" href="https://www.youtube.com/watch?v=vid-old"/>
            <published>2024-04-01T10:00:00+00:00</published>
          </entry>
        </feed>
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private YouTubeFeedDiscoveryClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        DigestProperties properties = new DigestProperties();
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(0);
        properties.getYoutube().setFeedBaseUrl(server.url("/feeds/videos.xml").toString());
        executor = Executors.newFixedThreadPool(1);
        client = new YouTubeFeedDiscoveryClient(new PoliteHttpClient(properties, executor), properties);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void listsOnlyEntriesPublishedAfterSince() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(FEED));

        List<DiscoveredVideo> videos = client.discover("UC123", Instant.parse("2024-05-01T00:00:00Z"));

        assertThat(videos).extracting(DiscoveredVideo::videoId).containsExactly("vid-new", "vid-mid");
        assertThat(videos.get(0).title()).isEqualTo("Newest upload");
        assertThat(videos.get(0).publishedAt()).isEqualTo(Instant.parse("2024-05-03T10:00:00Z"));
        assertThat(videos.get(1).title()).isEqualTo("Middle upload & more");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/feeds/videos.xml?channel_id=UC123");
    }

    @Test
    void sinceEqualToPublishedIsExcluded() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(FEED));

        List<DiscoveredVideo> videos = client.discover("UC123", Instant.parse("2024-05-03T10:00:00Z"));

        assertThat(videos).isEmpty();
    }

    @Test
    void rateLimitIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThatThrownBy(() -> client.discover("UC123", Instant.EPOCH))
            .isInstanceOfSatisfying(DiscoveryException.class, e -> {
                assertThat(e.isTransient()).isTrue();
                assertThat(e.getReasonCode()).isEqualTo(ReasonCodeClassifier.HTTP_429_RATE_LIMIT);
            });
    }

    @Test
    void unknownChannelIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> client.discover("UCmissing", Instant.EPOCH))
            .isInstanceOfSatisfying(DiscoveryException.class, e -> {
                assertThat(e.isTransient()).isFalse();
                assertThat(e.getReasonCode()).isEqualTo(ReasonCodeClassifier.HTTP_404);
            });
    }

    @Test
    void nonFeedPayloadIsAParsingFailure() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html><body>consent</body></html>"));

        assertThatThrownBy(() -> client.discover("UC123", Instant.EPOCH))
            .isInstanceOfSatisfying(DiscoveryException.class, e -> {
                assertThat(e.isTransient()).isFalse();
                assertThat(e.getReasonCode()).isEqualTo(ReasonCodeClassifier.PARSING_FAILED);
            });
    }

    @Test
    void extractsVideoIdFromWatchLink() {
        assertThat(YouTubeFeedDiscoveryClient.videoIdFromLink("https://www.youtube.com/watch?v=abc123&t=4")).isEqualTo("abc123");
        assertThat(YouTubeFeedDiscoveryClient.videoIdFromLink("https://www.youtube.com/shorts/abc")).isNull();
    }
}
