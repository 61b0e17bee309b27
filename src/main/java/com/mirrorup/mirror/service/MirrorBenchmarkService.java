package com.mirrorup.mirror.service;

import com.mirrorup.mirror.http.ProbeHttpClient;
import com.mirrorup.mirror.model.HttpFetchResult;
import com.mirrorup.mirror.model.MirrorRecord;
import com.mirrorup.mirror.model.ProbeOutcome;
import com.mirrorup.mirror.model.ProbeSummary;
import com.mirrorup.mirror.model.TargetRepository;
import com.mirrorup.mirror.util.MirrorUrls;
import com.mirrorup.mirror.util.ReasonCodeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Measures each mirror's transfer rate by downloading the target repository database once.
 * Probes run on a bounded pool; probe {@code i} only ever writes slot {@code i} of the result, so
 * the output order is the input order regardless of completion order.
 */
@Service
public class MirrorBenchmarkService {
    private static final Logger log = LoggerFactory.getLogger(MirrorBenchmarkService.class);
    private static final double MIN_ELAPSED_SECONDS = 1e-6;

    private final ProbeHttpClient probeHttpClient;

    public MirrorBenchmarkService(ProbeHttpClient probeHttpClient) {
        this.probeHttpClient = probeHttpClient;
    }

    public ProbeSummary probeAll(List<MirrorRecord> mirrors, TargetRepository target, int concurrency) {
        if (mirrors == null || mirrors.isEmpty()) {
            return new ProbeSummary(List.of(), List.of());
        }
        int poolSize = Math.max(1, Math.min(concurrency, mirrors.size()));
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            return probeAll(mirrors, target, executor);
        } finally {
            executor.shutdownNow();
        }
    }

    public ProbeSummary probeAll(List<MirrorRecord> mirrors, TargetRepository target, ExecutorService executor) {
        if (mirrors == null || mirrors.isEmpty()) {
            return new ProbeSummary(List.of(), List.of());
        }
        MirrorRecord[] slots = mirrors.toArray(new MirrorRecord[0]);
        ProbeOutcome[] outcomes = new ProbeOutcome[slots.length];

        List<CompletableFuture<Void>> futures = new ArrayList<>(slots.length);
        for (int i = 0; i < slots.length; i++) {
            int index = i;
            try {
                futures.add(CompletableFuture.runAsync(
                    () -> {
                        ProbeOutcome outcome = probe(slots[index], target);
                        outcomes[index] = outcome;
                        slots[index] = slots[index].withTransferRate(outcome.transferRate());
                    },
                    executor
                ));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.failedFuture(e));
            }
        }

        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("Probe of {} aborted: {}", slots[i].url(), cause.toString());
                outcomes[i] = ProbeOutcome.failure(
                    slots[i].url(),
                    probeUrl(slots[i], target),
                    Duration.ZERO,
                    ReasonCodeClassifier.UNKNOWN,
                    cause.toString()
                );
                slots[i] = slots[i].withTransferRate(null);
            }
        }

        ProbeSummary summary = new ProbeSummary(Arrays.asList(slots), Arrays.asList(outcomes));
        log.info(
            "Benchmarked {} mirrors against {}: succeeded={}, failed={} {}",
            slots.length,
            target.repoName(),
            summary.succeededCount(),
            summary.failedCount(),
            summary.failuresByReason()
        );
        return summary;
    }

    /**
     * Probes one mirror. Never throws for network or HTTP problems; those come back as a failed
     * outcome with no transfer rate.
     */
    public ProbeOutcome probe(MirrorRecord mirror, TargetRepository target) {
        String url = probeUrl(mirror, target);
        HttpFetchResult result = probeHttpClient.probe(url);
        String reason = ReasonCodeClassifier.classify(result);
        if (reason != null) {
            String detail = result.errorCode() != null ? result.errorMessage() : "HTTP " + result.statusCode();
            log.warn("Probe of {} failed: {} ({})", url, reason, detail);
            return ProbeOutcome.failure(mirror.url(), url, result.duration(), reason, detail);
        }
        double seconds = Math.max(MIN_ELAPSED_SECONDS, result.duration().toNanos() / 1_000_000_000.0);
        double rate = result.contentLength() / seconds;
        log.debug("Probe of {}: {} bytes in {}s = {} B/s", url, result.contentLength(), seconds, rate);
        return ProbeOutcome.success(mirror.url(), url, rate, result.duration());
    }

    static String probeUrl(MirrorRecord mirror, TargetRepository target) {
        return MirrorUrls.join(mirror.url(), target.databasePath());
    }
}
