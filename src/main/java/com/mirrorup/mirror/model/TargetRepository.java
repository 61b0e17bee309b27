package com.mirrorup.mirror.model;

import java.util.Locale;

/**
 * Package database fetched from each mirror to measure its transfer rate.
 */
public enum TargetRepository {
    CORE("core"),
    EXTRA("extra"),
    COMMUNITY("community");

    private final String repoName;

    TargetRepository(String repoName) {
        this.repoName = repoName;
    }

    public String repoName() {
        return repoName;
    }

    /**
     * Path of the database file relative to a mirror's base URL, e.g. {@code core/os/x86_64/core.db}.
     */
    public String databasePath() {
        return repoName + "/os/x86_64/" + repoName + ".db";
    }

    public static TargetRepository fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Target repository is blank");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TargetRepository candidate : values()) {
            if (candidate.repoName.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown target repository '" + raw + "'");
    }
}
