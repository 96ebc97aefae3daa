package ai.subtitle.translator.progress;

import ai.subtitle.translator.engine.ProcessingMode;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Persisted resume state for one target file. Instances are immutable; every transition returns
 * a new record.
 */
public record ProgressRecord(int schemaVersion,
                             String sourcePath,
                             String sourceHash,
                             String targetPath,
                             int totalUnits,
                             SortedSet<Integer> completedUnits,
                             SortedMap<Integer, String> translations,
                             SortedSet<Integer> failedUnits,
                             ProcessingMode mode,
                             String configFingerprint,
                             ProgressState state,
                             Instant createdAt,
                             Instant updatedAt) {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    public ProgressRecord {
        sourcePath = requireNonBlank(sourcePath, "sourcePath");
        sourceHash = requireNonBlank(sourceHash, "sourceHash");
        targetPath = requireNonBlank(targetPath, "targetPath");
        if (totalUnits < 1) {
            throw new IllegalArgumentException("totalUnits must be at least 1");
        }
        completedUnits = unmodifiableSet(completedUnits);
        translations = translations == null
                ? Collections.emptySortedMap()
                : Collections.unmodifiableSortedMap(new TreeMap<>(translations));
        failedUnits = unmodifiableSet(failedUnits);
        Objects.requireNonNull(mode, "mode");
        configFingerprint = requireNonBlank(configFingerprint, "configFingerprint");
        Objects.requireNonNull(state, "state");
        if (state == ProgressState.NOT_STARTED) {
            throw new IllegalArgumentException("a stored record is never NOT_STARTED");
        }
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        for (int unit : completedUnits) {
            requireUnitInRange(unit, totalUnits);
            if (!translations.containsKey(unit)) {
                throw new IllegalArgumentException("completed unit " + unit + " has no translation");
            }
        }
        if (!completedUnits.containsAll(translations.keySet())) {
            throw new IllegalArgumentException("translations cached for units not marked completed");
        }
        for (int unit : failedUnits) {
            requireUnitInRange(unit, totalUnits);
        }
        if (state == ProgressState.COMPLETED && completedUnits.size() != totalUnits) {
            throw new IllegalArgumentException("a completed record must cover every unit");
        }
    }

    /**
     * Creates the record for the first successful unit of a run.
     */
    public static ProgressRecord start(String sourcePath, String sourceHash, String targetPath, int totalUnits,
                                       ProcessingMode mode, String configFingerprint, Instant now) {
        return new ProgressRecord(CURRENT_SCHEMA_VERSION, sourcePath, sourceHash, targetPath, totalUnits,
                new TreeSet<>(), new TreeMap<>(), new TreeSet<>(), mode, configFingerprint,
                ProgressState.IN_PROGRESS, now, now);
    }

    /**
     * Adds or replaces cached translations. Units leave the failed set once translated.
     */
    public ProgressRecord withCompletedUnits(Map<Integer, String> newTranslations, Instant now) {
        SortedMap<Integer, String> mergedTranslations = new TreeMap<>(translations);
        mergedTranslations.putAll(newTranslations);
        SortedSet<Integer> completed = new TreeSet<>(completedUnits);
        completed.addAll(newTranslations.keySet());
        SortedSet<Integer> failed = new TreeSet<>(failedUnits);
        failed.removeAll(newTranslations.keySet());
        return new ProgressRecord(schemaVersion, sourcePath, sourceHash, targetPath, totalUnits, completed,
                mergedTranslations, failed, mode, configFingerprint, ProgressState.IN_PROGRESS, createdAt, now);
    }

    /**
     * Marks the run as ended with the given units untranslated.
     */
    public ProgressRecord withFailedUnits(Set<Integer> failed, Instant now) {
        SortedSet<Integer> merged = new TreeSet<>(failed);
        merged.removeAll(completedUnits);
        return new ProgressRecord(schemaVersion, sourcePath, sourceHash, targetPath, totalUnits, completedUnits,
                translations, merged, mode, configFingerprint, ProgressState.FAILED, createdAt, now);
    }

    public ProgressRecord complete(Instant now) {
        if (completedUnits.size() != totalUnits) {
            throw new IllegalStateException("%d of %d units are still pending".formatted(totalUnits - completedUnits.size(), totalUnits));
        }
        return new ProgressRecord(schemaVersion, sourcePath, sourceHash, targetPath, totalUnits, completedUnits,
                translations, new TreeSet<>(), mode, configFingerprint, ProgressState.COMPLETED, createdAt, now);
    }

    /**
     * Lowest unit id without a cached translation, or empty when every unit is done.
     */
    public OptionalInt firstPendingUnit() {
        for (int unit = 0; unit < totalUnits; unit++) {
            if (!completedUnits.contains(unit)) {
                return OptionalInt.of(unit);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Checks that this record was produced for the same source content, settings and unit count.
     *
     * @throws ConfigMismatchException describing the first difference found
     */
    public void validateFor(String currentSourceHash, String currentFingerprint, int currentTotalUnits) {
        if (!sourceHash.equals(currentSourceHash)) {
            throw new ConfigMismatchException("source content changed since the progress record was written");
        }
        if (!configFingerprint.equals(currentFingerprint)) {
            throw new ConfigMismatchException("translation settings changed since the progress record was written");
        }
        if (totalUnits != currentTotalUnits) {
            throw new ConfigMismatchException("unit count changed from %d to %d".formatted(totalUnits, currentTotalUnits));
        }
    }

    private static SortedSet<Integer> unmodifiableSet(Set<Integer> values) {
        return values == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }

    private static void requireUnitInRange(int unit, int totalUnits) {
        if (unit < 0 || unit >= totalUnits) {
            throw new IllegalArgumentException("unit " + unit + " outside [0, " + totalUnits + ")");
        }
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
