package ai.subtitle.translator.engine;

import ai.subtitle.translator.grouping.CrossEntryGroup;
import ai.subtitle.translator.translate.TranslatedUnit;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Mutable working set of one engine run, shared by the mode executors.
 */
final class EngineRun {

    private final List<CrossEntryGroup> units;
    private final SortedMap<Integer, String> translations;
    private final SortedSet<Integer> failedUnits = new TreeSet<>();
    private final Map<Integer, String> unreported = new LinkedHashMap<>();
    private final ProgressListener listener;
    private final CancellationToken token;
    private boolean cancelled;

    EngineRun(List<CrossEntryGroup> units, Map<Integer, String> completed, ProgressListener listener,
              CancellationToken token) {
        this.units = List.copyOf(units);
        this.translations = new TreeMap<>(completed);
        this.listener = Objects.requireNonNull(listener, "listener");
        this.token = Objects.requireNonNull(token, "token");
    }

    List<CrossEntryGroup> units() {
        return units;
    }

    CrossEntryGroup unit(int position) {
        return units.get(position);
    }

    boolean isDone(CrossEntryGroup unit) {
        return translations.containsKey(unit.unitId());
    }

    List<Integer> pendingPositions() {
        return IntStream.range(0, units.size())
                .filter(position -> !isDone(units.get(position)))
                .boxed()
                .collect(Collectors.toList());
    }

    String translationOf(int unitId) {
        return translations.get(unitId);
    }

    /**
     * Returns true and marks the run cancelled when a stop has been requested.
     */
    boolean stopRequested() {
        if (token.isStopRequested()) {
            cancelled = true;
        }
        return cancelled;
    }

    void record(Collection<TranslatedUnit> results) {
        Map<Integer, String> batch = new LinkedHashMap<>();
        for (TranslatedUnit result : results) {
            batch.put(result.unitId(), result.text().strip());
        }
        record(batch);
    }

    /**
     * Completes units that need no provider call. They reach the listener together with the next
     * successful call, so nothing is persisted before a provider has answered.
     */
    void prefill(Map<Integer, String> batch) {
        translations.putAll(batch);
        unreported.putAll(batch);
    }

    void record(Map<Integer, String> batch) {
        if (batch.isEmpty()) {
            return;
        }
        translations.putAll(batch);
        failedUnits.removeAll(batch.keySet());
        Map<Integer, String> update = new LinkedHashMap<>(unreported);
        update.putAll(batch);
        unreported.clear();
        listener.onUnitsTranslated(Map.copyOf(update));
    }

    void fail(Collection<Integer> unitIds) {
        failedUnits.addAll(unitIds);
    }

    ExecutionResult result(int providerCalls) {
        return new ExecutionResult(translations, failedUnits, cancelled, providerCalls);
    }
}
