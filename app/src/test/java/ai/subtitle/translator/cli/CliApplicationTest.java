package ai.subtitle.translator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.subtitle.translator.config.ConfigLoader;
import ai.subtitle.translator.engine.CancellationToken;
import ai.subtitle.translator.pipeline.FileTranslationSummary;
import ai.subtitle.translator.progress.ProgressState;
import ai.subtitle.translator.translate.ProviderFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String SUBTITLE = """
            1
            00:00:01,000 --> 00:00:02,500
            Where were you last night?

            2
            00:00:03,000 --> 00:00:04,000
            - Home.
            - Alone?
            """;

    @TempDir
    Path tempDir;

    @Test
    void mockRunWritesTranslatedFileBesideSource() throws IOException {
        Path input = writeInput("night.srt");

        int exitCode = application(Map.of()).run(new String[] {"--target", "de", "--translation-mode", "mock", input.toString()});

        assertThat(exitCode).isZero();
        String output = Files.readString(tempDir.resolve("night.de.srt"), StandardCharsets.UTF_8);
        assertThat(output).contains("[MOCK] Where were you last night?").contains("00:00:03,000 --> 00:00:04,000");
    }

    @Test
    void readsTargetLanguageFromEnvironmentAndHonoursOutputOption() throws IOException {
        Path input = writeInput("night.srt");
        Path output = tempDir.resolve("out").resolve("custom.srt");

        int exitCode = application(Map.of("TARGET_LANGUAGE", "hu", "TRANSLATION_MODE", "dry-run"))
                .run(new String[] {"-o", output.toString(), input.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output, StandardCharsets.UTF_8)).contains("Where were you last night?");
    }

    @Test
    void usageErrorsExitWithTwo() throws IOException {
        Path input = writeInput("night.srt");
        Path other = writeInput("day.srt");

        assertThat(application(Map.of()).run(new String[] {"--bogus", input.toString()})).isEqualTo(CliApplication.EXIT_USAGE);
        assertThat(application(Map.of()).run(new String[] {"--translation-mode", "mock", input.toString()}))
                .isEqualTo(CliApplication.EXIT_USAGE);
        assertThat(application(Map.of()).run(new String[] {"-t", "fr", "--translation-mode", "mock",
                "-o", tempDir.resolve("x.srt").toString(), input.toString(), other.toString()}))
                .isEqualTo(CliApplication.EXIT_USAGE);
        assertThat(application(Map.of("BATCH_SIZE", "zero")).run(new String[] {"-t", "fr", input.toString()}))
                .isEqualTo(CliApplication.EXIT_USAGE);
    }

    @Test
    void stopRequestedBeforeStartExitsAsCancelled() throws IOException {
        Path input = writeInput("night.srt");
        CancellationToken token = new CancellationToken();
        token.requestStop();
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()), new ProviderFactory(), token);

        int exitCode = application.run(new String[] {"-t", "fr", "--translation-mode", "mock", input.toString()});

        assertThat(exitCode).isEqualTo(CliApplication.EXIT_CANCELLED);
        assertThat(tempDir.resolve("night.fr.srt")).doesNotExist();
    }

    @Test
    void reformatOnlyRewritesFilesWithoutTargetLanguage() throws IOException {
        Path input = writeInput("night.srt");

        int exitCode = application(Map.of("ROW_SPLIT_METHOD", "word"))
                .run(new String[] {"--reformat-only", "--max-row-length", "20", input.toString()});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(input, StandardCharsets.UTF_8))
                .contains("00:00:01,000 --> 00:00:02,500\nWhere were you last\nnight?\n")
                .contains("- Home.\n- Alone?\n");
        assertThat(tempDir.resolve("night.fr.srt")).doesNotExist();
    }

    @Test
    void reformatOnlyHonoursOutputAndReportsParseFailures() throws IOException {
        Path input = writeInput("night.srt");
        Path output = tempDir.resolve("night.wrapped.srt");
        Path broken = tempDir.resolve("broken.srt");
        Files.writeString(broken, "1\nnot a timing line\nHello\n", StandardCharsets.UTF_8);

        assertThat(application(Map.of()).run(new String[] {"--reformat-only", "--max-row-length", "20",
                "-o", output.toString(), input.toString()})).isZero();
        assertThat(Files.readString(output, StandardCharsets.UTF_8)).contains("Where were you\nlast night?");
        assertThat(Files.readString(input, StandardCharsets.UTF_8)).isEqualTo(SUBTITLE);

        assertThat(application(Map.of()).run(new String[] {"--reformat-only", input.toString(), broken.toString()}))
                .isEqualTo(CliApplication.EXIT_FAILURES);
        assertThat(application(Map.of()).run(new String[] {"--reformat-only", "-o", output.toString(),
                input.toString(), broken.toString()})).isEqualTo(CliApplication.EXIT_USAGE);
    }

    @Test
    void exitCodeReflectsWorstOutcome() {
        FileTranslationSummary ok = summary(ProgressState.COMPLETED, 0, false);
        FileTranslationSummary partial = summary(ProgressState.FAILED, 1, false);
        FileTranslationSummary cancelled = summary(ProgressState.IN_PROGRESS, 0, true);

        assertThat(CliApplication.exitCode(List.of(ok, ok))).isEqualTo(CliApplication.EXIT_OK);
        assertThat(CliApplication.exitCode(List.of(ok, partial))).isEqualTo(CliApplication.EXIT_FAILURES);
        assertThat(CliApplication.exitCode(List.of(partial, cancelled))).isEqualTo(CliApplication.EXIT_CANCELLED);
        assertThat(CliApplication.exitCode(List.of(ok, FileTranslationSummary.failure(Path.of("a.srt"), Path.of("a.fr.srt"), "bad"))))
                .isEqualTo(CliApplication.EXIT_FAILURES);
    }

    private CliApplication application(Map<String, String> env) {
        return new CliApplication(new ConfigLoader(key -> Optional.ofNullable(env.get(key))), new ProviderFactory(),
                new CancellationToken());
    }

    private Path writeInput(String name) throws IOException {
        Path input = tempDir.resolve(name);
        Files.writeString(input, SUBTITLE, StandardCharsets.UTF_8);
        return input;
    }

    private static FileTranslationSummary summary(ProgressState state, int failed, boolean cancelled) {
        return new FileTranslationSummary(Path.of("a.srt"), Path.of("a.fr.srt"), 2, 2 - failed, failed, 0, 1, state,
                cancelled, !cancelled, Optional.empty());
    }
}
