package com.ekslens.leadmaster.lead.http;

import com.ekslens.leadmaster.config.LeadMasterProperties;
import com.ekslens.leadmaster.lead.model.HttpFetchResult;
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
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Outbound HTTP for collectors and the text augmenter. Calls are spaced per host, bounded by a
 * timeout and retried on transient failures. Never throws: failures come back as an
 * {@link HttpFetchResult} carrying an error code.
 */
@Service
public class RateLimitedHttpClient {
    private static final Duration RATE_LIMIT_BACKOFF = Duration.ofSeconds(30);

    private final LeadMasterProperties properties;
    private final HttpClient client;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public RateLimitedHttpClient(
        LeadMasterProperties properties,
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

    public HttpFetchResult get(String url, String acceptHeader, Duration hostInterval) {
        return send(url, "GET", acceptHeader, null, hostInterval, null);
    }

    public HttpFetchResult postJson(String url, String jsonBody, Duration hostInterval, Duration timeout) {
        return send(url, "POST", "application/json", jsonBody == null ? "" : jsonBody, hostInterval, timeout);
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        String body,
        Duration hostInterval,
        Duration timeout
    ) {
        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, method, acceptHeader, body, hostInterval, timeout);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
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
        Duration hostInterval,
        Duration timeout
    ) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            enforcePerHostDelay(host, hostInterval);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            Duration requestTimeout = timeout == null
                ? Duration.ofSeconds(properties.getRequestTimeoutSeconds())
                : timeout;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "es-ES,es;q=0.9,en;q=0.8");
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() == 429) {
                extendBackoff(host, RATE_LIMIT_BACKOFF);
            }
            byte[] responseBytes = response.body();
            return new HttpFetchResult(
                url,
                response.statusCode(),
                responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
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
        try {
            Thread.sleep((delay / 2) + jitter);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforcePerHostDelay(String host, Duration hostInterval) throws InterruptedException {
        long intervalMs = hostInterval == null ? 0 : Math.max(0, hostInterval.toMillis());
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(intervalMs));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
