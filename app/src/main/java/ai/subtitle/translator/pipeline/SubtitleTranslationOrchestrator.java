package ai.subtitle.translator.pipeline;

import ai.subtitle.translator.config.Config;
import ai.subtitle.translator.engine.CancellationToken;
import ai.subtitle.translator.engine.ExecutionEngine;
import ai.subtitle.translator.engine.ExecutionResult;
import ai.subtitle.translator.engine.ProgressListener;
import ai.subtitle.translator.engine.ProviderCaller;
import ai.subtitle.translator.grouping.CrossEntryGroup;
import ai.subtitle.translator.grouping.CrossEntryGrouper;
import ai.subtitle.translator.grouping.GroupReassembler;
import ai.subtitle.translator.progress.ConfigFingerprint;
import ai.subtitle.translator.progress.ConfigMismatchException;
import ai.subtitle.translator.progress.ContentHash;
import ai.subtitle.translator.progress.ProgressRecord;
import ai.subtitle.translator.progress.ProgressState;
import ai.subtitle.translator.progress.ProgressStore;
import ai.subtitle.translator.subtitle.SubtitleDocument;
import ai.subtitle.translator.subtitle.SubtitleEntry;
import ai.subtitle.translator.subtitle.SubtitleParser;
import ai.subtitle.translator.translate.TranslationProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Translates one subtitle file end to end: parse, group, resume or start progress, run the
 * engine, put translations back onto entries and write the output.
 */
public class SubtitleTranslationOrchestrator implements AutoCloseable {

    static final String MDC_FILE = "file";

    private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleTranslationOrchestrator.class);

    private final Config config;
    private final ProviderCaller caller;
    private final ExecutionEngine engine;
    private final CrossEntryGrouper grouper;
    private final GroupReassembler reassembler;
    private final SubtitleParser parser;
    private final String fingerprint;
    private final Clock clock;

    public SubtitleTranslationOrchestrator(Config config, List<TranslationProvider> providers) {
        this(config, new ProviderCaller(providers, config.retryPolicy()), Clock.systemUTC());
    }

    SubtitleTranslationOrchestrator(Config config, ProviderCaller caller, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.caller = Objects.requireNonNull(caller, "caller");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.engine = new ExecutionEngine(config.executionSettings(), caller);
        this.grouper = new CrossEntryGrouper(config.groupingRules(), config.crossEntryDetection());
        this.reassembler = new GroupReassembler();
        this.parser = new SubtitleParser();
        this.fingerprint = ConfigFingerprint.of(config);
    }

    /**
     * Translates {@code source} into {@code target}.
     *
     * @param restart discard any stored progress first
     * @throws ai.subtitle.translator.subtitle.SubtitleParseException when the source is malformed;
     *                                                                nothing is written in that case
     */
    public FileTranslationSummary translateFile(Path source, Path target, boolean restart, CancellationToken token) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(token, "token");
        MDC.put(MDC_FILE, String.valueOf(source.getFileName()));
        try {
            return translate(source, target, restart, token);
        } finally {
            MDC.remove(MDC_FILE);
        }
    }

    private FileTranslationSummary translate(Path source, Path target, boolean restart, CancellationToken token) {
        byte[] content = readAll(source);
        SubtitleDocument document = parser.parse(content);
        List<CrossEntryGroup> units = grouper.group(document);
        String sourceHash = ContentHash.sha256(content);
        LOGGER.info("Parsed {} entries into {} units", document.size(), units.size());

        ProgressStore store = ProgressStore.forTarget(target);
        if (restart && store.delete()) {
            LOGGER.info("Restart requested; discarded {}", store.progressFile());
        }
        Optional<ProgressRecord> stored = store.load().flatMap(found -> validated(found, store, sourceHash, units.size()));
        stored.ifPresent(found -> LOGGER.info("Found progress record: {} of {} units done, state {}, next unit {}",
                found.completedUnits().size(), found.totalUnits(), found.state(),
                found.firstPendingUnit().isPresent() ? found.firstPendingUnit().getAsInt() : "none"));

        ExecutionResult result;
        ProgressRecord progress;
        if (stored.isPresent() && stored.get().state() == ProgressState.COMPLETED) {
            LOGGER.info("Progress record is complete; writing output without provider calls");
            progress = stored.get();
            result = ExecutionResult.of(progress.translations(), Set.of(), false, 0);
        } else {
            PersistingListener listener = new PersistingListener(store, stored.orElse(null), source, target,
                    sourceHash, units.size());
            result = engine.execute(units, stored.<Map<Integer, String>>map(ProgressRecord::translations).orElse(Map.of()), listener, token);
            progress = finish(store, listener.current(), result, units.size());
        }

        ProgressState state = progress == null ? ProgressState.NOT_STARTED : progress.state();
        if (result.cancelled()) {
            LOGGER.warn("Cancelled with {} of {} units translated; output not written", result.translations().size(), units.size());
            return summary(source, target, units.size(), result, 0, state, true, false);
        }
        if (progress == null && !result.failedUnits().isEmpty()) {
            state = ProgressState.FAILED;
        } else if (progress == null && result.isComplete(units.size())) {
            state = ProgressState.COMPLETED;
        }

        int flagged = attachTranslations(units, result.translations());
        writeOutput(target, document.format(config.rowReflow()));
        return summary(source, target, units.size(), result, flagged, state, false, true);
    }

    private Optional<ProgressRecord> validated(ProgressRecord found, ProgressStore store, String sourceHash, int totalUnits) {
        try {
            found.validateFor(sourceHash, fingerprint, totalUnits);
            return Optional.of(found);
        } catch (ConfigMismatchException ex) {
            LOGGER.warn("Discarding stale progress {}: {}", store.progressFile(), ex.getMessage());
            store.delete();
            return Optional.empty();
        }
    }

    private ProgressRecord finish(ProgressStore store, ProgressRecord current, ExecutionResult result, int totalUnits) {
        if (current == null || result.cancelled()) {
            return current;
        }
        ProgressRecord finished;
        if (result.isComplete(totalUnits)) {
            finished = current.complete(clock.instant());
        } else if (!result.failedUnits().isEmpty()) {
            finished = current.withFailedUnits(result.failedUnits(), clock.instant());
        } else {
            return current;
        }
        store.save(finished);
        return finished;
    }

    private int attachTranslations(List<CrossEntryGroup> units, SortedMap<Integer, String> translations) {
        int flagged = 0;
        for (CrossEntryGroup unit : units) {
            String translated = translations.get(unit.unitId());
            if (translated != null) {
                flagged += reassembler.apply(unit, translated);
            } else {
                markFailed(unit);
            }
        }
        return flagged;
    }

    private void markFailed(CrossEntryGroup unit) {
        String placeholder = config.failedPlaceholder();
        if (placeholder.isBlank()) {
            return;
        }
        for (SubtitleEntry entry : unit.entries()) {
            entry.attachTranslation(placeholder + "\n" + entry.text());
        }
    }

    private void writeOutput(Path target, String formatted) {
        LOGGER.info("Wrote {}", OutputFiles.write(target, formatted));
    }

    private static byte[] readAll(Path source) {
        try {
            return Files.readAllBytes(source);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + source, ex);
        }
    }

    private static FileTranslationSummary summary(Path source, Path target, int totalUnits, ExecutionResult result,
                                                  int flagged, ProgressState state, boolean cancelled, boolean written) {
        return new FileTranslationSummary(source, target, totalUnits, result.translations().size(), result.failedUnits().size(),
                flagged, result.providerCalls(), state, cancelled, written, Optional.empty());
    }

    @Override
    public void close() {
        caller.close();
    }

    /**
     * Creates the progress record on the first successful unit and saves it after every update.
     */
    private final class PersistingListener implements ProgressListener {

        private final ProgressStore store;
        private final Path source;
        private final Path target;
        private final String sourceHash;
        private final int totalUnits;
        private ProgressRecord current;

        PersistingListener(ProgressStore store, ProgressRecord resumed, Path source, Path target,
                           String sourceHash, int totalUnits) {
            this.store = store;
            this.current = resumed;
            this.source = source;
            this.target = target;
            this.sourceHash = sourceHash;
            this.totalUnits = totalUnits;
        }

        @Override
        public synchronized void onUnitsTranslated(Map<Integer, String> translations) {
            if (current == null) {
                current = ProgressRecord.start(source.toAbsolutePath().normalize().toString(), sourceHash,
                        target.toAbsolutePath().normalize().toString(), totalUnits, config.processingMode(),
                        fingerprint, clock.instant());
            }
            current = current.withCompletedUnits(translations, clock.instant());
            store.save(current);
        }

        synchronized ProgressRecord current() {
            return current;
        }
    }
}
