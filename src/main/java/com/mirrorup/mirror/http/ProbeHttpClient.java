package com.mirrorup.mirror.http;

import com.mirrorup.config.MirrorUpProperties;
import com.mirrorup.mirror.model.HttpFetchResult;
import com.mirrorup.mirror.util.MirrorUrls;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Issues the single measurement GET against a mirror. One attempt, no compression, relaxed TLS
 * validation, and a deadline that covers the whole exchange including the body.
 */
@Service
public class ProbeHttpClient {
    private final MirrorUpProperties properties;
    private final HttpClient client;

    public ProbeHttpClient(
        MirrorUpProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(properties.getProbe().getTimeoutSeconds()))
            .sslContext(InsecureTrustManager.sslContext())
            .proxy(HttpClient.Builder.NO_PROXY)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult probe(String url) {
        Instant startedAt = Instant.now();
        URI uri = MirrorUrls.safeUri(url);
        if (uri == null || uri.getHost() == null || !MirrorUrls.isHttpScheme(uri)) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }
        int timeoutSeconds = properties.getProbe().getTimeoutSeconds();
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .header("User-Agent", MirrorUpProperties.normalizeUserAgent(properties.getUserAgent()))
            .header("Accept", "*/*")
            .header("Accept-Encoding", "identity")
            .GET()
            .build();

        CompletableFuture<HttpResponse<byte[]>> pending = null;
        try {
            pending = client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
            HttpResponse<byte[]> response = pending.get(timeoutSeconds, TimeUnit.SECONDS);
            Instant finishedAt = Instant.now();
            OptionalLong declaredLength = response.headers().firstValueAsLong("Content-Length");
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                null,
                declaredLength.isPresent() ? declaredLength.getAsLong() : null,
                response.headers().firstValue("Content-Encoding").orElse(null),
                finishedAt,
                Duration.between(startedAt, finishedAt),
                null,
                null
            );
        } catch (TimeoutException e) {
            cancel(pending);
            return errorResult(url, startedAt, "timeout", "No complete response within " + timeoutSeconds + "s");
        } catch (InterruptedException e) {
            cancel(pending);
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return errorResult(url, startedAt, "timeout", cause.getMessage());
            }
            if (cause instanceof IOException) {
                return errorResult(url, startedAt, "io_error", describe(cause));
            }
            return errorResult(url, startedAt, "http_error", describe(cause));
        } catch (RuntimeException e) {
            cancel(pending);
            return errorResult(url, startedAt, "http_error", describe(e));
        }
    }

    private static void cancel(CompletableFuture<?> pending) {
        if (pending != null) {
            pending.cancel(true);
        }
    }

    private static String describe(Throwable e) {
        StringBuilder detail = new StringBuilder();
        Throwable current = e;
        while (current != null && detail.length() < 512) {
            if (detail.length() > 0) {
                detail.append(" <- ");
            }
            detail.append(current.getClass().getSimpleName());
            if (current.getMessage() != null) {
                detail.append(": ").append(current.getMessage());
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return detail.toString();
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
