package com.mirrorup.mirror.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MirrorCatalog(
    @JsonProperty("cutoff") Long cutoff,
    @JsonProperty("last_check") String lastCheck,
    @JsonProperty("num_checks") Long numChecks,
    @JsonProperty("check_frequency") Long checkFrequency,
    @JsonProperty("urls") List<MirrorRecord> urls,
    @JsonProperty("version") Integer version
) {
    public MirrorCatalog {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }
}
