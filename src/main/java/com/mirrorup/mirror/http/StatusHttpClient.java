package com.mirrorup.mirror.http;

import com.mirrorup.config.MirrorUpProperties;
import com.mirrorup.mirror.model.HttpFetchResult;
import com.mirrorup.mirror.util.MirrorUrls;
import com.mirrorup.mirror.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.zip.GZIPInputStream;

/**
 * Fetches the mirror status document. Transport failures and transient HTTP statuses are retried
 * with a doubling delay up to a fixed number of attempts.
 */
@Service
public class StatusHttpClient {
    private static final Logger log = LoggerFactory.getLogger(StatusHttpClient.class);
    public static final String DECODE_ERROR = "decode_error";

    private final MirrorUpProperties properties;
    private final HttpClient client;

    public StatusHttpClient(
        MirrorUpProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(properties.getStatus().getRequestTimeoutSeconds()))
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url) {
        int maxAttempts = properties.getStatus().getMaxAttempts();
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            log.debug(
                "Status fetch attempt {}/{} for {} failed (status={}, error={}), retrying",
                attempt,
                maxAttempts,
                url,
                lastResult.statusCode(),
                lastResult.errorCode()
            );
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(String url) {
        Instant startedAt = Instant.now();
        URI uri = MirrorUrls.safeUri(url);
        if (uri == null || uri.getHost() == null || !MirrorUrls.isHttpScheme(uri)) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getStatus().getRequestTimeoutSeconds()))
            .header("User-Agent", MirrorUpProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", "application/json")
            .header("Accept-Encoding", "gzip")
            .GET()
            .build();
        HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", describe(e));
        }

        String contentEncoding = response.headers().firstValue("Content-Encoding").orElse(null);
        byte[] body = response.body();
        String errorCode = null;
        String errorMessage = null;
        try {
            body = decode(body, contentEncoding);
        } catch (IOException e) {
            // Transfer completed, so an undecodable body is never retried.
            errorCode = DECODE_ERROR;
            errorMessage = describe(e);
        }
        return new HttpFetchResult(
            url,
            response.uri(),
            response.statusCode(),
            body,
            body == null ? null : (long) body.length,
            contentEncoding,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            errorCode,
            errorMessage
        );
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        if (result.errorCode() != null) {
            return ReasonCodeClassifier.isRetryable(
                ReasonCodeClassifier.fromErrorCode(result.errorCode(), result.errorMessage())
            );
        }
        if (result.isSuccessful()) {
            return false;
        }
        return ReasonCodeClassifier.isRetryable(ReasonCodeClassifier.fromHttpStatus(result.statusCode()));
    }

    private boolean sleepBackoff(int attempt) {
        long delay = backoffDelayMs(attempt);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    long backoffDelayMs(int attempt) {
        int baseDelayMs = properties.getStatus().getRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return 0;
        }
        long delay = (long) baseDelayMs * (1L << Math.min(30, Math.max(0, attempt - 1)));
        int maxDelayMs = properties.getStatus().getRetryMaxDelayMs();
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        return delay;
    }

    private byte[] decode(byte[] body, String contentEncoding) throws IOException {
        if (body == null || contentEncoding == null) {
            return body;
        }
        if (!contentEncoding.toLowerCase(Locale.ROOT).contains("gzip")) {
            return body;
        }
        try (GZIPInputStream gzipInputStream = new GZIPInputStream(new ByteArrayInputStream(body))) {
            return gzipInputStream.readAllBytes();
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }
}
