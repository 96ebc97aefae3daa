package ai.subtitle.translator.pipeline;

import ai.subtitle.translator.engine.CancellationToken;
import ai.subtitle.translator.subtitle.SubtitleParseException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs several files concurrently on a fixed pool, one orchestrator per file. A file that fails
 * to parse or read does not affect the others.
 */
public class MultiFileTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiFileTranslator.class);

    private final int parallelism;
    private final Supplier<SubtitleTranslationOrchestrator> orchestratorFactory;

    public MultiFileTranslator(int parallelism, Supplier<SubtitleTranslationOrchestrator> orchestratorFactory) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        this.parallelism = parallelism;
        this.orchestratorFactory = Objects.requireNonNull(orchestratorFactory, "orchestratorFactory");
    }

    /**
     * Translates every job and returns one summary per job, in job order.
     *
     * @throws IllegalArgumentException when two jobs write the same target
     */
    public List<FileTranslationSummary> translateAll(List<TranslationJob> jobs, boolean restart, CancellationToken token) {
        Objects.requireNonNull(jobs, "jobs");
        Objects.requireNonNull(token, "token");
        rejectSharedTargets(jobs);
        if (jobs.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(parallelism, jobs.size());
        AtomicInteger counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads,
                runnable -> new Thread(runnable, "translate-file-" + counter.incrementAndGet()));
        try {
            List<Future<FileTranslationSummary>> futures = new ArrayList<>(jobs.size());
            for (TranslationJob job : jobs) {
                futures.add(executor.submit(task(job, restart, token)));
            }
            List<FileTranslationSummary> summaries = new ArrayList<>(jobs.size());
            for (int i = 0; i < futures.size(); i++) {
                summaries.add(await(futures.get(i), jobs.get(i)));
            }
            return summaries;
        } finally {
            executor.shutdown();
        }
    }

    private Callable<FileTranslationSummary> task(TranslationJob job, boolean restart, CancellationToken token) {
        return () -> {
            LOGGER.info("Translating {} -> {}", job.source(), job.target());
            try (SubtitleTranslationOrchestrator orchestrator = orchestratorFactory.get()) {
                return orchestrator.translateFile(job.source(), job.target(), restart, token);
            } catch (SubtitleParseException ex) {
                LOGGER.error("Cannot parse {}: {}", job.source(), ex.getMessage());
                return FileTranslationSummary.failure(job.source(), job.target(), ex.getMessage());
            } catch (UncheckedIOException ex) {
                LOGGER.error("I/O failure for {}: {}", job.source(), ex.getMessage());
                return FileTranslationSummary.failure(job.source(), job.target(), ex.getMessage());
            }
        };
    }

    private FileTranslationSummary await(Future<FileTranslationSummary> future, TranslationJob job) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return FileTranslationSummary.failure(job.source(), job.target(), "interrupted");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            LOGGER.error("Translation of {} failed", job.source(), cause);
            return FileTranslationSummary.failure(job.source(), job.target(), String.valueOf(cause.getMessage()));
        }
    }

    private static void rejectSharedTargets(List<TranslationJob> jobs) {
        Map<Path, Path> sourcesByTarget = new HashMap<>();
        for (TranslationJob job : jobs) {
            Path target = job.target().toAbsolutePath().normalize();
            Path previous = sourcesByTarget.putIfAbsent(target, job.source());
            if (previous != null) {
                throw new IllegalArgumentException("%s and %s would both write %s".formatted(previous, job.source(), target));
            }
        }
    }
}
