package com.mirrorup.mirror.service;

import com.mirrorup.config.MirrorUpProperties;
import com.mirrorup.mirror.model.MirrorRecord;
import com.mirrorup.mirror.model.ProbeSummary;
import com.mirrorup.mirror.model.TargetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns measured transfer rates and upstream scores into a weighted score and keeps the best
 * mirrors.
 *
 * <p>Upstream scores are "lower is better", so each mirror's score is subtracted from the worst
 * score in the set and multiplied by its transfer rate. A mirror without an upstream score has an
 * undefined weighted score (NaN) and ranks after every mirror with a numeric one.
 */
@Service
public class MirrorEvaluationService {
    private static final Logger log = LoggerFactory.getLogger(MirrorEvaluationService.class);

    /**
     * Descending by weighted score with undefined scores last; equal scores fall back to the higher
     * measured transfer rate. Anything still tied keeps its incoming order.
     * An unmeasured mirror therefore loses a tie against a measured one, even when it had the
     * smaller sync delay.
     */
    public static final Comparator<MirrorRecord> BY_WEIGHTED_SCORE_DESC = (a, b) -> {
        int byScore = compareDescendingNaNLast(valueOrNaN(a.weightedScore()), valueOrNaN(b.weightedScore()));
        if (byScore != 0) {
            return byScore;
        }
        return compareDescendingNaNLast(valueOrNaN(a.transferRate()), valueOrNaN(b.transferRate()));
    };

    private final MirrorBenchmarkService benchmarkService;
    private final MirrorUpProperties properties;

    public MirrorEvaluationService(MirrorBenchmarkService benchmarkService, MirrorUpProperties properties) {
        this.benchmarkService = benchmarkService;
        this.properties = properties;
    }

    public List<MirrorRecord> evaluate(List<MirrorRecord> mirrors, int selectCount, TargetRepository target) {
        return evaluate(mirrors, selectCount, target, properties.getThreads());
    }

    /**
     * Benchmarks every candidate, scores them and returns at most {@code selectCount} mirrors,
     * best first.
     *
     * @throws NoBestMirrorsException when nothing is left to select
     */
    public List<MirrorRecord> evaluate(
        List<MirrorRecord> mirrors,
        int selectCount,
        TargetRepository target,
        int concurrency
    ) {
        List<MirrorRecord> candidates = mirrors == null ? List.of() : mirrors;
        ProbeSummary probes = benchmarkService.probeAll(candidates, target, concurrency);

        List<MirrorRecord> scored = sortByWeightedScore(score(probes.mirrors()));
        List<MirrorRecord> selected = select(scored, selectCount);
        if (selected.isEmpty()) {
            throw new NoBestMirrorsException("No best mirrors: nothing left to select from "
                + candidates.size() + " candidates");
        }
        log.info(
            "Selected {} of {} mirrors (measured={}, requested={})",
            selected.size(),
            scored.size(),
            probes.succeededCount(),
            selectCount
        );
        return selected;
    }

    /**
     * Largest upstream score in the set, or 0.0 when no mirror has one.
     */
    public static double maxScore(List<MirrorRecord> mirrors) {
        double max = 0.0;
        boolean found = false;
        for (MirrorRecord mirror : mirrors) {
            Double score = mirror.score();
            if (score == null || score.isNaN()) {
                continue;
            }
            if (!found || score > max) {
                max = score;
                found = true;
            }
        }
        return max;
    }

    public static List<MirrorRecord> score(List<MirrorRecord> mirrors) {
        double maxScore = maxScore(mirrors);
        List<MirrorRecord> scored = new ArrayList<>(mirrors.size());
        for (MirrorRecord mirror : mirrors) {
            double rate = mirror.transferRate() == null ? 0.0 : mirror.transferRate();
            double score = mirror.score() == null ? Double.NaN : mirror.score();
            scored.add(mirror.withWeightedScore(rate * (maxScore - score)));
        }
        return scored;
    }

    public static List<MirrorRecord> sortByWeightedScore(List<MirrorRecord> mirrors) {
        List<MirrorRecord> sorted = new ArrayList<>(mirrors);
        sorted.sort(BY_WEIGHTED_SCORE_DESC);
        return sorted;
    }

    public static List<MirrorRecord> select(List<MirrorRecord> mirrors, int count) {
        if (count <= 0) {
            return List.of();
        }
        if (mirrors.size() <= count) {
            return new ArrayList<>(mirrors);
        }
        return new ArrayList<>(mirrors.subList(0, count));
    }

    private static double valueOrNaN(Double value) {
        return value == null ? Double.NaN : value;
    }

    private static int compareDescendingNaNLast(double a, double b) {
        boolean aMissing = Double.isNaN(a);
        boolean bMissing = Double.isNaN(b);
        if (aMissing || bMissing) {
            return Boolean.compare(aMissing, bMissing);
        }
        if (a == b) {
            return 0;
        }
        return a > b ? -1 : 1;
    }
}
