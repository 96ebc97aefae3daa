package ai.subtitle.translator.engine;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Outcome of one engine run.
 *
 * @param translations  translated text per unit id, including units completed before the run
 * @param failedUnits   units that exhausted every provider in this run
 * @param cancelled     whether the run stopped early on request
 * @param providerCalls provider invocations made in this run, retries included
 */
public record ExecutionResult(SortedMap<Integer, String> translations,
                              SortedSet<Integer> failedUnits,
                              boolean cancelled,
                              int providerCalls) {

    public ExecutionResult {
        translations = Collections.unmodifiableSortedMap(new TreeMap<>(Objects.requireNonNull(translations, "translations")));
        failedUnits = Collections.unmodifiableSortedSet(new TreeSet<>(Objects.requireNonNull(failedUnits, "failedUnits")));
    }

    public static ExecutionResult of(Map<Integer, String> translations, Set<Integer> failedUnits,
                                     boolean cancelled, int providerCalls) {
        return new ExecutionResult(new TreeMap<>(translations), new TreeSet<>(failedUnits), cancelled, providerCalls);
    }

    public boolean isComplete(int totalUnits) {
        return translations.size() == totalUnits;
    }
}
