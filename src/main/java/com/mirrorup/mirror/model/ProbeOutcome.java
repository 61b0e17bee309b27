package com.mirrorup.mirror.model;

import java.time.Duration;

/**
 * Result of benchmarking a single mirror. {@code reasonCode} is null when the probe produced a
 * transfer rate.
 */
public record ProbeOutcome(
    String mirrorUrl,
    String probeUrl,
    Double transferRate,
    Duration elapsed,
    String reasonCode,
    String detail
) {
    public static ProbeOutcome success(String mirrorUrl, String probeUrl, double transferRate, Duration elapsed) {
        return new ProbeOutcome(mirrorUrl, probeUrl, transferRate, elapsed, null, null);
    }

    public static ProbeOutcome failure(String mirrorUrl, String probeUrl, Duration elapsed, String reasonCode, String detail) {
        return new ProbeOutcome(mirrorUrl, probeUrl, null, elapsed, reasonCode, detail);
    }

    public boolean isSuccessful() {
        return reasonCode == null && transferRate != null;
    }
}
