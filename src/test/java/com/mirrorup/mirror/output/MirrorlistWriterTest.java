package com.mirrorup.mirror.output;

import com.mirrorup.mirror.TestMirrors;
import com.mirrorup.mirror.model.MirrorRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MirrorlistWriterTest {
    private final MirrorlistWriter writer = new MirrorlistWriter();

    @TempDir
    Path tempDir;

    @Test
    void serverLineAppendsRepoAndArchPlaceholders() {
        MirrorRecord mirror = TestMirrors.synced("https://mirror.example/archlinux/", 10, 1.0);

        assertThat(MirrorlistWriter.serverLine(mirror)).isEqualTo("Server = https://mirror.example/archlinux/$repo/os/$arch");
    }

    @Test
    void writesOneLinePerMirrorInOrder() throws Exception {
        StringWriter out = new StringWriter();

        writer.write(out, List.of(
            TestMirrors.synced("https://b.example/", 10, 1.0),
            TestMirrors.synced("https://a.example/", 10, 1.0)
        ));

        assertThat(out.toString()).isEqualTo(
            "Server = https://b.example/$repo/os/$arch\nServer = https://a.example/$repo/os/$arch\n"
        );
    }

    @Test
    void emptyListWritesNothing() throws Exception {
        StringWriter out = new StringWriter();
        writer.write(out, List.of());
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void headerNamesSourceAndGenerationTime() {
        ZonedDateTime when = ZonedDateTime.of(2026, 10, 17, 8, 30, 0, 0, ZoneOffset.UTC);

        String header = writer.header("https://archlinux.org/mirrors/status/json/", when);

        assertThat(header).contains("# source: https://archlinux.org/mirrors/status/json/\n");
        assertThat(header).contains("# when: Sat, 17 Oct 2026 08:30:00 GMT\n");
        assertThat(header).endsWith("#\n\n");
    }

    @Test
    void refusesToOverwriteExistingFile() throws Exception {
        Path path = tempDir.resolve("mirrorlist");
        Files.writeString(path, "original", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> writer.write(path, List.of(), "https://status.example/"))
            .isInstanceOf(FileAlreadyExistsException.class);
        assertThat(Files.readString(path, StandardCharsets.UTF_8)).isEqualTo("original");
    }
}
