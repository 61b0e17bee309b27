package com.mirrorup.mirror.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Inputs of one ranking pass, resolved from configuration and command-line options.
 */
public record RankingRequest(
    String sourceUrl,
    TargetRepository targetRepository,
    int maxCheck,
    int selectCount,
    int concurrency,
    List<String> excludeLiterals,
    Path excludeFile
) {
    public RankingRequest {
        excludeLiterals = excludeLiterals == null ? List.of() : List.copyOf(excludeLiterals);
        maxCheck = Math.max(0, maxCheck);
        selectCount = Math.max(1, selectCount);
        concurrency = Math.max(1, concurrency);
    }

    public boolean hasExclusions() {
        return excludeFile != null || !excludeLiterals.isEmpty();
    }
}
