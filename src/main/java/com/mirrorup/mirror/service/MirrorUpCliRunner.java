package com.mirrorup.mirror.service;

import com.mirrorup.config.MirrorUpProperties;
import com.mirrorup.mirror.model.MirrorRecord;
import com.mirrorup.mirror.model.RankingRequest;
import com.mirrorup.mirror.model.TargetRepository;
import com.mirrorup.mirror.output.MirrorlistWriter;
import com.mirrorup.mirror.output.StatsCsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one ranking pass at startup and exits. Besides the {@code mirrorup.*} properties it accepts
 * short options: {@code --source-url}, {@code --target-db}, {@code --mirrors}, {@code --threads},
 * {@code --max-check}, {@code --exclude} (repeat the flag for several rules), {@code --exclude-from},
 * {@code --output-file} and {@code --stats-file}.
 *
 * <p>There is no verbosity flag. Log detail is set with {@code MIRRORUP_LOG_LEVEL} or
 * {@code --logging.level.com.mirrorup=DEBUG}; {@code WARN} keeps only probe failures and errors.
 */
@Component
public class MirrorUpCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(MirrorUpCliRunner.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    private final MirrorUpProperties properties;
    private final MirrorRankingService rankingService;
    private final MirrorlistWriter mirrorlistWriter;
    private final StatsCsvWriter statsCsvWriter;
    private final ConfigurableApplicationContext applicationContext;

    public MirrorUpCliRunner(
        MirrorUpProperties properties,
        MirrorRankingService rankingService,
        MirrorlistWriter mirrorlistWriter,
        StatsCsvWriter statsCsvWriter,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.rankingService = rankingService;
        this.mirrorlistWriter = mirrorlistWriter;
        this.statsCsvWriter = statsCsvWriter;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        int exitCode = execute(args, System.out);

        if (properties.getCli().isExitAfterRun()) {
            int code = SpringApplication.exit(applicationContext, () -> exitCode);
            System.exit(code);
        }
    }

    int execute(ApplicationArguments args, PrintStream stdout) {
        try {
            RankingRequest request = resolveRequest(args);
            Path outputFile = resolvePath(optionValue(args, "output-file", properties.getOutputFile()), "output-file");
            Path statsFile = resolvePath(optionValue(args, "stats-file", properties.getStatsFile()), "stats-file");
            ensureAbsent(outputFile);
            ensureAbsent(statsFile);
            log.debug("Run with {}", request);

            List<MirrorRecord> best = rankingService.rank(request);

            if (statsFile != null) {
                statsCsvWriter.write(statsFile, best);
                log.info("Saved statistics of {} mirrors to {}", best.size(), statsFile);
            }
            if (outputFile != null) {
                mirrorlistWriter.write(outputFile, best, request.sourceUrl());
                log.info("Saved mirrorlist with {} mirrors to {}", best.size(), outputFile);
            } else {
                Writer writer = new OutputStreamWriter(stdout, StandardCharsets.UTF_8);
                mirrorlistWriter.write(writer, best);
                if (stdout.checkError()) {
                    log.debug("Standard output closed before the mirror list was fully written");
                }
            }
            return EXIT_SUCCESS;
        } catch (MirrorUpException e) {
            log.error("{}", e.getMessage());
            log.debug("Run failed", e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Could not write output: {}", e.getMessage());
            log.debug("Run failed", e);
            return EXIT_FAILURE;
        }
    }

    RankingRequest resolveRequest(ApplicationArguments args) {
        String sourceUrl = optionValue(args, "source-url", properties.getSourceUrl());
        String rawTarget = optionValue(args, "target-db", null);
        TargetRepository target = properties.getTargetDb();
        if (rawTarget != null) {
            try {
                target = TargetRepository.fromName(rawTarget);
            } catch (IllegalArgumentException e) {
                throw new MirrorUpException("Invalid --target-db: " + e.getMessage(), e);
            }
        }

        List<String> excludes = new ArrayList<>(properties.getExclude());
        if (args.containsOption("exclude") && args.getOptionValues("exclude") != null) {
            // One rule per flag; a value such as "country=korea, south" keeps its comma.
            for (String value : args.getOptionValues("exclude")) {
                if (value != null && !value.isBlank()) {
                    excludes.add(value.trim());
                }
            }
        }

        int selectCount = intOption(args, "mirrors", properties.getMirrors());
        if (selectCount <= 0) {
            throw new MirrorUpException("Invalid --mirrors value '" + selectCount + "': at least one mirror must be selected");
        }

        return new RankingRequest(
            sourceUrl,
            target,
            intOption(args, "max-check", properties.getMaxCheck()),
            selectCount,
            intOption(args, "threads", properties.getThreads()),
            excludes,
            resolvePath(optionValue(args, "exclude-from", properties.getExcludeFrom()), "exclude-from")
        );
    }

    private static void ensureAbsent(Path path) {
        if (path != null && Files.exists(path)) {
            throw new OutputFileExistsException(path);
        }
    }

    private static Path resolvePath(String raw, String option) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Path.of(raw.trim());
        } catch (InvalidPathException e) {
            throw new MirrorUpException("Invalid --" + option + " path '" + raw + "'", e);
        }
    }

    private static String optionValue(ApplicationArguments args, String name, String fallback) {
        if (args == null || !args.containsOption(name)) {
            return fallback;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return fallback;
        }
        // Last occurrence wins, like repeated command-line flags usually do.
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static int intOption(ApplicationArguments args, String name, int fallback) {
        String raw = optionValue(args, name, null);
        if (raw == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new MirrorUpException("Invalid --" + name + " value '" + raw + "'", e);
        }
    }
}
