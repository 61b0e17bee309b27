package com.mirrorup.mirror.output;

import com.mirrorup.mirror.model.MirrorRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders ranked mirrors in pacman's mirrorlist format.
 */
@Component
public class MirrorlistWriter {

    public static String serverLine(MirrorRecord mirror) {
        return "Server = " + mirror.url() + "$repo/os/$arch";
    }

    public String toMirrorlist(List<MirrorRecord> mirrors) {
        StringBuilder list = new StringBuilder();
        for (MirrorRecord mirror : mirrors) {
            list.append(serverLine(mirror)).append('\n');
        }
        return list.toString();
    }

    public String header(String sourceUrl, ZonedDateTime when) {
        return "#\n"
            + "# /etc/pacman.d/mirrorlist\n"
            + "#\n"
            + "#\n"
            + "# Arch Linux mirrorlist generated by mirrorup\n"
            + "#\n"
            + "# source: " + sourceUrl + "\n"
            + "# when: " + DateTimeFormatter.RFC_1123_DATE_TIME.format(when) + "\n"
            + "#\n"
            + "\n";
    }

    /**
     * Writes header and server lines to a new file; an existing file is never overwritten.
     */
    public void write(Path path, List<MirrorRecord> mirrors, String sourceUrl) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE_NEW,
            StandardOpenOption.WRITE
        )) {
            writer.write(header(sourceUrl, ZonedDateTime.now()));
            writer.write(toMirrorlist(mirrors));
        }
    }

    public void write(Writer writer, List<MirrorRecord> mirrors) throws IOException {
        writer.write(toMirrorlist(mirrors));
        writer.flush();
    }
}
