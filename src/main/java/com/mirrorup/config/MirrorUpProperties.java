package com.mirrorup.config;

import com.mirrorup.mirror.model.TargetRepository;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "mirrorup")
public class MirrorUpProperties {
    private static final String DEFAULT_USER_AGENT = "mirrorup/1.0.0 (+https://github.com/mirrorup/mirrorup)";
    public static final String DEFAULT_SOURCE_URL = "https://archlinux.org/mirrors/status/json/";

    private String userAgent;
    private String sourceUrl = DEFAULT_SOURCE_URL;
    private TargetRepository targetDb = TargetRepository.EXTRA;
    private int mirrors = 10;
    private int threads = 5;
    private int maxCheck = 100;
    private List<String> exclude = new ArrayList<>();
    private String excludeFrom;
    private String outputFile;
    private String statsFile;
    private Status status = new Status();
    private Probe probe = new Probe();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getSourceUrl() {
        return sourceUrl == null || sourceUrl.isBlank() ? DEFAULT_SOURCE_URL : sourceUrl.trim();
    }

    public void setSourceUrl(String sourceUrl) {
        this.sourceUrl = sourceUrl;
    }

    public TargetRepository getTargetDb() {
        return targetDb == null ? TargetRepository.EXTRA : targetDb;
    }

    public void setTargetDb(TargetRepository targetDb) {
        this.targetDb = targetDb;
    }

    public int getMirrors() {
        return Math.max(1, mirrors);
    }

    public void setMirrors(int mirrors) {
        this.mirrors = Math.max(1, mirrors);
    }

    public int getThreads() {
        return Math.max(1, threads);
    }

    public void setThreads(int threads) {
        this.threads = Math.max(1, threads);
    }

    /**
     * Maximum number of synced mirrors that get benchmarked. Zero means no limit.
     */
    public int getMaxCheck() {
        return Math.max(0, maxCheck);
    }

    public void setMaxCheck(int maxCheck) {
        this.maxCheck = Math.max(0, maxCheck);
    }

    public List<String> getExclude() {
        return exclude;
    }

    public void setExclude(List<String> exclude) {
        this.exclude = exclude == null ? new ArrayList<>() : exclude;
    }

    public String getExcludeFrom() {
        return excludeFrom;
    }

    public void setExcludeFrom(String excludeFrom) {
        this.excludeFrom = excludeFrom;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public void setOutputFile(String outputFile) {
        this.outputFile = outputFile;
    }

    public String getStatsFile() {
        return statsFile;
    }

    public void setStatsFile(String statsFile) {
        this.statsFile = statsFile;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public Probe getProbe() {
        return probe;
    }

    public void setProbe(Probe probe) {
        this.probe = probe;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Status {
        private int requestTimeoutSeconds = 30;
        private int maxAttempts = 5;
        private int retryBaseDelayMs = 1000;
        private int retryMaxDelayMs = 16000;

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }
    }

    public static class Probe {
        private int timeoutSeconds = 10;

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Cli {
        private boolean run = true;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
