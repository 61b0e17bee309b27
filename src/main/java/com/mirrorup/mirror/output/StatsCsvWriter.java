package com.mirrorup.mirror.output;

import com.mirrorup.mirror.model.MirrorRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.List;

/**
 * Dumps evaluated mirrors, measurements included, as CSV for offline statistics.
 */
@Component
public class StatsCsvWriter {
    static final String[] HEADERS = {
        "url",
        "protocol",
        "last_sync",
        "completion_pct",
        "delay",
        "duration_avg",
        "duration_stddev",
        "score",
        "active",
        "country",
        "country_code",
        "isos",
        "ipv4",
        "ipv6",
        "details",
        "transfer_rate",
        "weighted_score"
    };

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(HEADERS)
        .setRecordSeparator("\n")
        .build();

    public void write(Path path, List<MirrorRecord> mirrors) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE_NEW,
            StandardOpenOption.WRITE
        )) {
            write(writer, mirrors);
        }
    }

    public void write(Writer writer, List<MirrorRecord> mirrors) throws IOException {
        CSVPrinter printer = new CSVPrinter(writer, FORMAT);
        for (MirrorRecord mirror : mirrors) {
            printer.printRecord(row(mirror));
        }
        printer.flush();
    }

    static List<Object> row(MirrorRecord mirror) {
        return Arrays.asList(
            mirror.url(),
            mirror.protocol(),
            mirror.lastSync(),
            mirror.completionPct(),
            mirror.delay(),
            mirror.durationAvg(),
            mirror.durationStddev(),
            mirror.score(),
            mirror.active(),
            mirror.country(),
            mirror.countryCode(),
            mirror.isos(),
            mirror.ipv4(),
            mirror.ipv6(),
            mirror.details(),
            mirror.transferRate(),
            mirror.weightedScore()
        );
    }
}
