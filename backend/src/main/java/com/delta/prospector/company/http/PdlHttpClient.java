package com.delta.prospector.company.http;

import com.delta.prospector.config.ProspectorProperties;
import com.delta.prospector.company.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rate-limited JSON client for the People Data Labs API.
 *
 * <p>Requests are spaced by {@code prospector.upstream.min-request-interval-ms}; a 429 pushes the
 * next allowed request out by the configured backoff. 408, 429, 5xx, timeouts and I/O errors are
 * retried with jittered exponential backoff. Failures are reported through the returned
 * {@link HttpFetchResult}, never thrown.
 */
@Service
public class PdlHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PdlHttpClient.class);

    private final ProspectorProperties properties;
    private final HttpClient client;
    private final Object pacingLock = new Object();
    private Instant nextAllowedAt = Instant.EPOCH;

    public PdlHttpClient(
        ProspectorProperties properties,
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

    public HttpFetchResult postJson(String path, String jsonBody) {
        String url = resolveUrl(path);
        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, jsonBody, attempt);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug(
                "Retrying {} after attempt {} took {} ms (status={}, error={})",
                url,
                attempt,
                lastResult.duration().toMillis(),
                lastResult.statusCode(),
                lastResult.errorCode()
            );
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(String url, String jsonBody, int attempt) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, attempt, "invalid_url", "URL missing host or malformed");
        }
        try {
            awaitPacing();

            String apiKey = properties.getUpstream().getApiKey();
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", ProspectorProperties.normalizeUserAgent(properties.getUserAgent()))
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .header("X-Api-Key", apiKey == null ? "" : apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody == null ? "" : jsonBody, StandardCharsets.UTF_8))
                .build();

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() == 429) {
                extendBackoff(Duration.ofSeconds(properties.getUpstream().getRateLimitBackoffSeconds()));
            }
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                Duration.between(startedAt, Instant.now()),
                attempt,
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, attempt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, attempt, "io_error", e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, attempt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, attempt, "http_error", e.getMessage());
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
        return status == 408 || status == 429 || status >= 500;
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

    private void awaitPacing() throws InterruptedException {
        synchronized (pacingLock) {
            Instant now = Instant.now();
            if (nextAllowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, nextAllowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            nextAllowedAt = Instant.now().plusMillis(properties.getUpstream().getMinRequestIntervalMs());
        }
    }

    private void extendBackoff(Duration duration) {
        synchronized (pacingLock) {
            Instant candidate = Instant.now().plus(duration);
            if (candidate.isAfter(nextAllowedAt)) {
                nextAllowedAt = candidate;
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, int attempt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            Duration.between(startedAt, Instant.now()),
            attempt,
            code,
            message
        );
    }

    private String resolveUrl(String path) {
        String base = properties.getUpstream().getBaseUrl();
        if (base == null) {
            base = "";
        }
        String safePath = path == null ? "" : path;
        if (base.endsWith("/") && safePath.startsWith("/")) {
            return base + safePath.substring(1);
        }
        if (!base.endsWith("/") && !safePath.isEmpty() && !safePath.startsWith("/")) {
            return base + "/" + safePath;
        }
        return base + safePath;
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
