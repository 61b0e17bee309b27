package com.mirrorup.config;

import com.mirrorup.mirror.model.TargetRepository;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MirrorUpPropertiesGuardrailTest {

    @Test
    void clampsCountsToUsableMinimums() {
        MirrorUpProperties properties = new MirrorUpProperties();
        properties.setMirrors(0);
        properties.setThreads(-3);
        properties.setMaxCheck(-1);
        properties.getStatus().setMaxAttempts(0);
        properties.getProbe().setTimeoutSeconds(0);

        assertThat(properties.getMirrors()).isEqualTo(1);
        assertThat(properties.getThreads()).isEqualTo(1);
        assertThat(properties.getMaxCheck()).isZero();
        assertThat(properties.getStatus().getMaxAttempts()).isEqualTo(1);
        assertThat(properties.getProbe().getTimeoutSeconds()).isEqualTo(1);
    }

    @Test
    void blankValuesFallBackToDefaults() {
        MirrorUpProperties properties = new MirrorUpProperties();
        properties.setUserAgent("  ");
        properties.setSourceUrl("");
        properties.setTargetDb(null);
        properties.setExclude(null);

        assertThat(properties.getUserAgent()).startsWith("mirrorup/");
        assertThat(properties.getSourceUrl()).isEqualTo(MirrorUpProperties.DEFAULT_SOURCE_URL);
        assertThat(properties.getTargetDb()).isEqualTo(TargetRepository.EXTRA);
        assertThat(properties.getExclude()).isEmpty();
    }
}
