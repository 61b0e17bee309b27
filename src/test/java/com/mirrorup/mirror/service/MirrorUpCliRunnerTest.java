package com.mirrorup.mirror.service;

import com.mirrorup.config.MirrorUpProperties;
import com.mirrorup.mirror.TestMirrors;
import com.mirrorup.mirror.model.MirrorRecord;
import com.mirrorup.mirror.model.RankingRequest;
import com.mirrorup.mirror.model.TargetRepository;
import com.mirrorup.mirror.output.MirrorlistWriter;
import com.mirrorup.mirror.output.StatsCsvWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MirrorUpCliRunnerTest {
    private static final List<MirrorRecord> BEST = List.of(
        TestMirrors.synced("https://b.example/arch/", 20, 1.0).withTransferRate(20.0).withWeightedScore(0.0),
        TestMirrors.synced("https://a.example/arch/", 10, 1.0).withTransferRate(10.0).withWeightedScore(0.0)
    );

    @TempDir
    Path tempDir;

    private MirrorUpProperties properties;
    private MirrorRankingService rankingService;
    private MirrorUpCliRunner runner;
    private ByteArrayOutputStream stdout;

    @BeforeEach
    void setUp() {
        properties = new MirrorUpProperties();
        rankingService = Mockito.mock(MirrorRankingService.class);
        runner = new MirrorUpCliRunner(
            properties,
            rankingService,
            new MirrorlistWriter(),
            new StatsCsvWriter(),
            Mockito.mock(ConfigurableApplicationContext.class)
        );
        stdout = new ByteArrayOutputStream();
    }

    @Test
    void printsServerLinesToStdoutByDefault() {
        when(rankingService.rank(any())).thenReturn(BEST);

        int exitCode = runner.execute(new DefaultApplicationArguments(), new PrintStream(stdout, true));

        assertThat(exitCode).isEqualTo(MirrorUpCliRunner.EXIT_SUCCESS);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEqualTo(
            "Server = https://b.example/arch/$repo/os/$arch\n"
                + "Server = https://a.example/arch/$repo/os/$arch\n"
        );
    }

    @Test
    void resolvesShortOptionsOverProperties() {
        properties.setExclude(List.of("from.properties"));

        RankingRequest request = runner.resolveRequest(new DefaultApplicationArguments(
            "--source-url=https://status.example/json/",
            "--target-db=core",
            "--mirrors=3",
            "--threads=8",
            "--max-check=0",
            "--exclude=a.example",
            "--exclude=country_code=de",
            "--exclude=!b.example",
            "--mirrors=4"
        ));

        assertThat(request.sourceUrl()).isEqualTo("https://status.example/json/");
        assertThat(request.targetRepository()).isEqualTo(TargetRepository.CORE);
        assertThat(request.selectCount()).isEqualTo(4);
        assertThat(request.concurrency()).isEqualTo(8);
        assertThat(request.maxCheck()).isZero();
        assertThat(request.excludeLiterals())
            .containsExactly("from.properties", "a.example", "country_code=de", "!b.example");
        assertThat(request.excludeFile()).isNull();
    }

    @Test
    void excludeValueKeepsItsComma() {
        RankingRequest request = runner.resolveRequest(new DefaultApplicationArguments(
            "--exclude=country=korea, south"
        ));

        assertThat(request.excludeLiterals()).containsExactly("country=korea, south");
    }

    @Test
    void zeroMirrorsIsAFailure() {
        int exitCode = runner.execute(new DefaultApplicationArguments("--mirrors=0"), new PrintStream(stdout, true));

        assertThat(exitCode).isEqualTo(MirrorUpCliRunner.EXIT_FAILURE);
        verify(rankingService, never()).rank(any());
    }

    @Test
    void defaultsComeFromProperties() {
        RankingRequest request = runner.resolveRequest(new DefaultApplicationArguments());

        assertThat(request.sourceUrl()).isEqualTo(MirrorUpProperties.DEFAULT_SOURCE_URL);
        assertThat(request.targetRepository()).isEqualTo(TargetRepository.EXTRA);
        assertThat(request.selectCount()).isEqualTo(10);
        assertThat(request.concurrency()).isEqualTo(5);
        assertThat(request.maxCheck()).isEqualTo(100);
        assertThat(request.hasExclusions()).isFalse();
    }

    @Test
    void writesMirrorlistAndStatsFiles() throws Exception {
        when(rankingService.rank(any())).thenReturn(BEST);
        Path output = tempDir.resolve("mirrorlist");
        Path stats = tempDir.resolve("stats.csv");

        int exitCode = runner.execute(new DefaultApplicationArguments(
            "--output-file=" + output,
            "--stats-file=" + stats
        ), new PrintStream(stdout, true));

        assertThat(exitCode).isEqualTo(MirrorUpCliRunner.EXIT_SUCCESS);
        assertThat(stdout.size()).isZero();
        String mirrorlist = Files.readString(output, StandardCharsets.UTF_8);
        assertThat(mirrorlist).startsWith("#\n# /etc/pacman.d/mirrorlist\n");
        assertThat(mirrorlist).endsWith(
            "Server = https://b.example/arch/$repo/os/$arch\n"
                + "Server = https://a.example/arch/$repo/os/$arch\n"
        );
        assertThat(Files.readAllLines(stats, StandardCharsets.UTF_8)).hasSize(3);
    }

    @Test
    void existingOutputFileFailsBeforeRanking() throws Exception {
        Path output = tempDir.resolve("mirrorlist");
        Files.writeString(output, "keep me", StandardCharsets.UTF_8);

        int exitCode = runner.execute(new DefaultApplicationArguments("--output-file=" + output), new PrintStream(stdout, true));

        assertThat(exitCode).isEqualTo(MirrorUpCliRunner.EXIT_FAILURE);
        assertThat(Files.readString(output, StandardCharsets.UTF_8)).isEqualTo("keep me");
        verify(rankingService, never()).rank(any());
    }

    @Test
    void invalidTargetIsAFailure() {
        int exitCode = runner.execute(new DefaultApplicationArguments("--target-db=testing"), new PrintStream(stdout, true));

        assertThat(exitCode).isEqualTo(MirrorUpCliRunner.EXIT_FAILURE);
        verify(rankingService, never()).rank(any());
    }

    @Test
    void invalidNumberIsAFailure() {
        int exitCode = runner.execute(new DefaultApplicationArguments("--mirrors=many"), new PrintStream(stdout, true));

        assertThat(exitCode).isEqualTo(MirrorUpCliRunner.EXIT_FAILURE);
    }

    @Test
    void rankingErrorsBecomeFailureExitCode() {
        when(rankingService.rank(any())).thenThrow(new NoCandidatesException("No best synced mirrors"));

        int exitCode = runner.execute(new DefaultApplicationArguments(), new PrintStream(stdout, true));

        assertThat(exitCode).isEqualTo(MirrorUpCliRunner.EXIT_FAILURE);
        assertThat(stdout.size()).isZero();
    }

    @Test
    void excludeFromOptionIsPassedThrough() {
        when(rankingService.rank(any())).thenReturn(BEST);
        Path rules = tempDir.resolve("excluded_mirrors.conf");

        runner.execute(new DefaultApplicationArguments("--exclude-from=" + rules), new PrintStream(stdout, true));

        ArgumentCaptor<RankingRequest> captor = ArgumentCaptor.forClass(RankingRequest.class);
        verify(rankingService).rank(captor.capture());
        assertThat(captor.getValue().excludeFile()).isEqualTo(rules);
    }
}
