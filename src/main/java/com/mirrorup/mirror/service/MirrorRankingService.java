package com.mirrorup.mirror.service;

import com.mirrorup.mirror.exclude.ExclusionRules;
import com.mirrorup.mirror.model.MirrorCatalog;
import com.mirrorup.mirror.model.MirrorRecord;
import com.mirrorup.mirror.model.RankingRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One ranking pass: exclusion rules, catalog fetch, sync filter, benchmark and selection, in that
 * order, on the calling thread.
 */
@Service
public class MirrorRankingService {
    private static final Logger log = LoggerFactory.getLogger(MirrorRankingService.class);

    private final MirrorStatusService statusService;
    private final SyncFilterService syncFilterService;
    private final MirrorEvaluationService evaluationService;

    public MirrorRankingService(
        MirrorStatusService statusService,
        SyncFilterService syncFilterService,
        MirrorEvaluationService evaluationService
    ) {
        this.statusService = statusService;
        this.syncFilterService = syncFilterService;
        this.evaluationService = evaluationService;
    }

    public List<MirrorRecord> rank(RankingRequest request) {
        Instant startedAt = Instant.now();
        // Rule problems must surface before any network activity.
        ExclusionRules rules = buildExclusionRules(request);

        MirrorCatalog catalog = statusService.fetch(request.sourceUrl());
        List<MirrorRecord> candidates = syncFilterService.filter(catalog, request.maxCheck(), rules);
        List<MirrorRecord> best = evaluationService.evaluate(
            candidates,
            request.selectCount(),
            request.targetRepository(),
            request.concurrency()
        );
        log.info(
            "Ranking completed in {}ms: candidates={}, selected={}",
            Duration.between(startedAt, Instant.now()).toMillis(),
            candidates.size(),
            best.size()
        );
        return best;
    }

    /**
     * File rules come first and command-line literals after them, so a literal overrides a
     * conflicting rule from the file.
     */
    public ExclusionRules buildExclusionRules(RankingRequest request) {
        if (!request.hasExclusions()) {
            return null;
        }
        ExclusionRules rules = ExclusionRules.fromFile(request.excludeFile())
            .then(ExclusionRules.of(request.excludeLiterals()));
        log.debug("Excluded mirrors: {}", rules);
        return rules;
    }
}
