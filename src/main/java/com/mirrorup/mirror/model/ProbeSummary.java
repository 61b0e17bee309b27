package com.mirrorup.mirror.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ProbeSummary(List<MirrorRecord> mirrors, List<ProbeOutcome> outcomes) {
    public ProbeSummary {
        mirrors = List.copyOf(mirrors);
        outcomes = List.copyOf(outcomes);
    }

    public int succeededCount() {
        return (int) outcomes.stream().filter(ProbeOutcome::isSuccessful).count();
    }

    public int failedCount() {
        return outcomes.size() - succeededCount();
    }

    public Map<String, Integer> failuresByReason() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ProbeOutcome outcome : outcomes) {
            if (!outcome.isSuccessful()) {
                counts.merge(outcome.reasonCode(), 1, Integer::sum);
            }
        }
        return counts;
    }
}
