package com.mirrorup.mirror.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the mirror status catalog. {@code transferRate} and {@code weightedScore} are
 * never supplied by the catalog; they are filled in by the benchmark and scoring passes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MirrorRecord(
    @JsonProperty("url") String url,
    @JsonProperty("protocol") String protocol,
    @JsonProperty("last_sync") String lastSync,
    @JsonProperty("completion_pct") Double completionPct,
    @JsonProperty("delay") Long delay,
    @JsonProperty("duration_avg") Double durationAvg,
    @JsonProperty("duration_stddev") Double durationStddev,
    @JsonProperty("score") Double score,
    @JsonProperty("active") boolean active,
    @JsonProperty("country") String country,
    @JsonProperty("country_code") String countryCode,
    @JsonProperty("isos") boolean isos,
    @JsonProperty("ipv4") boolean ipv4,
    @JsonProperty("ipv6") boolean ipv6,
    @JsonProperty("details") String details,
    @JsonProperty("transfer_rate") Double transferRate,
    @JsonProperty("weighted_score") Double weightedScore
) {
    public MirrorRecord withTransferRate(Double rate) {
        return new MirrorRecord(
            url,
            protocol,
            lastSync,
            completionPct,
            delay,
            durationAvg,
            durationStddev,
            score,
            active,
            country,
            countryCode,
            isos,
            ipv4,
            ipv6,
            details,
            rate,
            weightedScore
        );
    }

    public MirrorRecord withWeightedScore(Double weighted) {
        return new MirrorRecord(
            url,
            protocol,
            lastSync,
            completionPct,
            delay,
            durationAvg,
            durationStddev,
            score,
            active,
            country,
            countryCode,
            isos,
            ipv4,
            ipv6,
            details,
            transferRate,
            weighted
        );
    }
}
