package ai.subtitle.translator.cli;

import ai.subtitle.translator.config.Config;
import ai.subtitle.translator.config.ConfigLoader;
import ai.subtitle.translator.config.SystemEnvironmentReader;
import ai.subtitle.translator.engine.CancellationToken;
import ai.subtitle.translator.logging.LoggingConfigurator;
import ai.subtitle.translator.pipeline.FileTranslationSummary;
import ai.subtitle.translator.pipeline.MultiFileTranslator;
import ai.subtitle.translator.pipeline.SubtitleReformatter;
import ai.subtitle.translator.pipeline.SubtitleTranslationOrchestrator;
import ai.subtitle.translator.pipeline.TranslationJob;
import ai.subtitle.translator.translate.ProviderFactory;
import ai.subtitle.translator.translate.TranslationProvider;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and file runner.
 */
public final class CliApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURES = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELLED = 130;

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    private static final long SHUTDOWN_FLUSH_SECONDS = 30;

    private final ConfigLoader configLoader;
    private final ProviderFactory providerFactory;
    private final CancellationToken token;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new ProviderFactory(), new CancellationToken());
    }

    CliApplication(ConfigLoader configLoader, ProviderFactory providerFactory, CancellationToken token) {
        this.configLoader = configLoader;
        this.providerFactory = providerFactory;
        this.token = token;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return EXIT_USAGE;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }
        if (cliArguments.reformatOnly()) {
            return reformat(cliArguments, commandLine);
        }

        Config config;
        List<TranslationJob> jobs;
        List<TranslationProvider> providers;
        try {
            config = configLoader.load(cliArguments);
            jobs = jobsFor(cliArguments, config);
            LoggingConfigurator.configure(config.logFormat());
            providers = providerFactory.create(config);
        } catch (IllegalArgumentException | IllegalStateException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_USAGE;
        }
        LOGGER.info("Translating {} file(s) {} -> {} in {} mode via {}", jobs.size(), config.sourceLanguage(),
                config.targetLanguage(), config.processingMode().id(),
                providers.stream().map(TranslationProvider::name).collect(Collectors.joining(", ")));

        MultiFileTranslator runner = new MultiFileTranslator(config.parallelism(),
                () -> new SubtitleTranslationOrchestrator(config, providers));
        CountDownLatch finished = new CountDownLatch(1);
        Thread shutdownHook = new Thread(() -> {
            token.requestStop();
            LOGGER.warn("Stop requested; finishing in-flight work and saving progress");
            awaitQuietly(finished);
        }, "shutdown-flush");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        List<FileTranslationSummary> summaries;
        try {
            summaries = runner.translateAll(jobs, cliArguments.restart(), token);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_USAGE;
        } finally {
            finished.countDown();
            removeShutdownHook(shutdownHook);
        }

        summaries.forEach(summary -> {
            if (summary.isSuccessful()) {
                LOGGER.info(summary.describe());
            } else {
                LOGGER.warn(summary.describe());
            }
        });
        return exitCode(summaries);
    }

    private int reformat(CliArguments arguments, CommandLine commandLine) {
        List<Path> inputs = arguments.inputs();
        SubtitleReformatter reformatter;
        try {
            if (arguments.output() != null && inputs.size() != 1) {
                throw new IllegalArgumentException("--output can only be used with a single input file");
            }
            LoggingConfigurator.configure(configLoader.loadLogFormat(arguments));
            reformatter = new SubtitleReformatter(configLoader.loadRowReflow(arguments));
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return EXIT_USAGE;
        }
        boolean succeeded = arguments.output() != null
                ? reformatter.tryReformat(inputs.get(0), arguments.output())
                : reformatter.reformatInPlace(inputs) == 0;
        return succeeded ? EXIT_OK : EXIT_FAILURES;
    }

    static int exitCode(List<FileTranslationSummary> summaries) {
        if (summaries.stream().anyMatch(FileTranslationSummary::cancelled)) {
            return EXIT_CANCELLED;
        }
        if (summaries.stream().allMatch(FileTranslationSummary::isSuccessful)) {
            return EXIT_OK;
        }
        return EXIT_FAILURES;
    }

    static List<TranslationJob> jobsFor(CliArguments arguments, Config config) {
        List<Path> inputs = arguments.inputs();
        if (arguments.output() != null) {
            if (inputs.size() != 1) {
                throw new IllegalArgumentException("--output can only be used with a single input file");
            }
            return List.of(new TranslationJob(inputs.get(0), arguments.output()));
        }
        return inputs.stream()
                .map(input -> TranslationJob.besideSource(input, config.targetLanguage()))
                .collect(Collectors.toList());
    }

    private static void awaitQuietly(CountDownLatch finished) {
        try {
            if (!finished.await(SHUTDOWN_FLUSH_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("In-flight work did not finish within {} seconds", SHUTDOWN_FLUSH_SECONDS);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException ex) {
            LOGGER.debug("JVM is already shutting down; keeping the flush hook");
        }
    }
}
