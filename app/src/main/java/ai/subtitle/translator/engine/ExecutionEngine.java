package ai.subtitle.translator.engine;

import ai.subtitle.translator.grouping.CrossEntryGroup;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the configured processing mode over the unit sequence, skipping units that are already
 * completed.
 */
public class ExecutionEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutionEngine.class);

    private final ExecutionSettings settings;
    private final ProviderCaller caller;

    public ExecutionEngine(ExecutionSettings settings, ProviderCaller caller) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.caller = Objects.requireNonNull(caller, "caller");
    }

    public ExecutionSettings settings() {
        return settings;
    }

    /**
     * Translates every pending unit.
     *
     * @param units     the whole unit sequence of the file, in order
     * @param completed translations already available, keyed by unit id
     * @param listener  notified after each successful provider call
     * @param token     checked before each provider call
     */
    public ExecutionResult execute(List<CrossEntryGroup> units,
                                   Map<Integer, String> completed,
                                   ProgressListener listener,
                                   CancellationToken token) {
        Objects.requireNonNull(units, "units");
        Objects.requireNonNull(completed, "completed");
        EngineRun run = new EngineRun(units, completed, listener, token);
        int callsBefore = caller.callCount();

        Map<Integer, String> empty = new LinkedHashMap<>();
        for (CrossEntryGroup unit : units) {
            if (!run.isDone(unit) && unit.sourceText().isBlank()) {
                empty.put(unit.unitId(), "");
            }
        }
        run.prefill(empty);

        int pending = run.pendingPositions().size();
        LOGGER.info("Translating {} of {} units in {} mode", pending, units.size(), settings.mode().id());
        if (pending > 0) {
            executorFor(settings.mode()).execute(run);
        }
        ExecutionResult result = run.result(caller.callCount() - callsBefore);
        LOGGER.info("Engine finished: {} translated, {} failed, cancelled={}, provider calls={}",
                result.translations().size(), result.failedUnits().size(), result.cancelled(), result.providerCalls());
        return result;
    }

    ModeExecutor executorFor(ProcessingMode mode) {
        return switch (mode) {
            case LINE_BY_LINE -> new LineByLineExecutor(settings, caller);
            case BATCH -> new BatchExecutor(settings, caller);
            case WHOLE_FILE -> new WholeFileExecutor(settings, caller);
        };
    }
}
