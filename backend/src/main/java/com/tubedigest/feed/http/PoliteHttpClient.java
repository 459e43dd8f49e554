package com.tubedigest.feed.http;

import com.tubedigest.config.DigestProperties;
import com.tubedigest.feed.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Blocking HTTP access for the feed, transcript and LLM clients. Every request carries
 * the configured timeout. {@link #get} retries network errors, 408 and 5xx responses a
 * bounded number of times; 429 is returned at once so the caller can report throttling.
 * <p>
 * Calls paced by the rate governor use {@link #getOnce} and {@link #postJson}, which make
 * exactly one request. Their retries go back through the governor.
 */
@Service
public class PoliteHttpClient {
    private final DigestProperties properties;
    private final HttpClient client;

    public PoliteHttpClient(
        DigestProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return send(url, "GET", acceptHeader, null, Map.of(), 1 + properties.getRequestMaxRetries());
    }

    public HttpFetchResult getOnce(String url, String acceptHeader) {
        return send(url, "GET", acceptHeader, null, Map.of(), 1);
    }

    public HttpFetchResult postJson(String url, String jsonBody, Map<String, String> headers) {
        return send(url, "POST", "application/json", jsonBody == null ? "" : jsonBody, headers, 1);
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        String body,
        Map<String, String> headers,
        int attempts
    ) {
        int maxAttempts = Math.max(1, attempts);
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, method, acceptHeader, body, headers);
            if (lastResult == null || !shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(
        String url,
        String method,
        String acceptHeader,
        String body,
        Map<String, String> headers
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", DigestProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", safeAccept)
            .header("Accept-Language", "en-US,en;q=0.8");
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null && !value.isBlank()) {
                    builder.header(name, value);
                }
            });
        }
        HttpRequest request;
        if ("POST".equalsIgnoreCase(method)) {
            request = builder
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                .build();
        } else {
            request = builder.GET().build();
        }

        try {
            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        }
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = result.statusCode();
        return status == 408 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
