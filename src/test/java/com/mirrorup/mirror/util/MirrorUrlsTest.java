package com.mirrorup.mirror.util;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class MirrorUrlsTest {

    @Test
    void hostIsLowercasedAndNullWhenMissing() {
        assertThat(MirrorUrls.host("https://Mirror.Example.ORG:8443/arch/")).isEqualTo("mirror.example.org");
        assertThat(MirrorUrls.host("not a url")).isNull();
        assertThat(MirrorUrls.host("")).isNull();
        assertThat(MirrorUrls.host(null)).isNull();
    }

    @Test
    void joinUsesExactlyOneSlash() {
        assertThat(MirrorUrls.join("https://m/arch/", "core/os/x86_64/core.db")).isEqualTo("https://m/arch/core/os/x86_64/core.db");
        assertThat(MirrorUrls.join("https://m/arch", "core/os/x86_64/core.db")).isEqualTo("https://m/arch/core/os/x86_64/core.db");
        assertThat(MirrorUrls.join("https://m/arch/", "/core.db")).isEqualTo("https://m/arch/core.db");
    }

    @Test
    void onlyHttpSchemesAreAccepted() {
        assertThat(MirrorUrls.isHttpScheme(URI.create("HTTPS://m/"))).isTrue();
        assertThat(MirrorUrls.isHttpScheme(URI.create("http://m/"))).isTrue();
        assertThat(MirrorUrls.isHttpScheme(URI.create("rsync://m/"))).isFalse();
        assertThat(MirrorUrls.isHttpScheme(null)).isFalse();
    }
}
