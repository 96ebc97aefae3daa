package ai.subtitle.translator.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.subtitle.translator.engine.ProcessingMode;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class ProgressRecordTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant LATER = Instant.parse("2024-05-01T10:05:00Z");

    private final ProgressRecord started = ProgressRecord.start("/in/movie.srt", "hash", "/in/movie.fr.srt", 3,
            ProcessingMode.BATCH, "fingerprint", CREATED);

    @Test
    void completedUnitsMergeAndLeaveTheFailedSet() {
        ProgressRecord failed = started.withCompletedUnits(Map.of(0, "Un."), CREATED)
                .withFailedUnits(Set.of(1, 2), CREATED);

        ProgressRecord resumed = failed.withCompletedUnits(Map.of(1, "Deux."), LATER);

        assertThat(failed.state()).isEqualTo(ProgressState.FAILED);
        assertThat(resumed.state()).isEqualTo(ProgressState.IN_PROGRESS);
        assertThat(resumed.completedUnits()).containsExactly(0, 1);
        assertThat(resumed.failedUnits()).containsExactly(2);
        assertThat(resumed.translations()).containsEntry(1, "Deux.");
        assertThat(resumed.createdAt()).isEqualTo(CREATED);
        assertThat(resumed.updatedAt()).isEqualTo(LATER);
        assertThat(resumed.firstPendingUnit()).hasValue(2);
    }

    @Test
    void completesOnlyWhenEveryUnitIsTranslated() {
        ProgressRecord partial = started.withCompletedUnits(Map.of(0, "Un.", 1, "Deux."), LATER);

        assertThatThrownBy(() -> partial.complete(LATER))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("1 of 3 units are still pending");

        ProgressRecord done = partial.withCompletedUnits(Map.of(2, "Trois."), LATER).complete(LATER);
        assertThat(done.state()).isEqualTo(ProgressState.COMPLETED);
        assertThat(done.firstPendingUnit()).isEmpty();
    }

    @Test
    void rejectsInconsistentRecords() {
        SortedMap<Integer, String> translations = new TreeMap<>(Map.of(0, "Un."));

        assertThatThrownBy(() -> new ProgressRecord(1, "/a", "h", "/b", 2, new TreeSet<>(Set.of(0, 1)), translations,
                new TreeSet<>(), ProcessingMode.BATCH, "f", ProgressState.IN_PROGRESS, CREATED, CREATED))
                .hasMessage("completed unit 1 has no translation");
        assertThatThrownBy(() -> new ProgressRecord(1, "/a", "h", "/b", 2, new TreeSet<>(), translations,
                new TreeSet<>(), ProcessingMode.BATCH, "f", ProgressState.IN_PROGRESS, CREATED, CREATED))
                .hasMessage("translations cached for units not marked completed");
        assertThatThrownBy(() -> new ProgressRecord(1, "/a", "h", "/b", 2, new TreeSet<>(Set.of(0)), translations,
                new TreeSet<>(Set.of(2)), ProcessingMode.BATCH, "f", ProgressState.FAILED, CREATED, CREATED))
                .hasMessage("unit 2 outside [0, 2)");
        assertThatThrownBy(() -> new ProgressRecord(1, "/a", "h", "/b", 2, new TreeSet<>(Set.of(0)), translations,
                new TreeSet<>(), ProcessingMode.BATCH, "f", ProgressState.COMPLETED, CREATED, CREATED))
                .hasMessage("a completed record must cover every unit");
    }

    @Test
    void validatesAgainstCurrentRun() {
        started.validateFor("hash", "fingerprint", 3);

        assertThatThrownBy(() -> started.validateFor("other", "fingerprint", 3))
                .isInstanceOf(ConfigMismatchException.class)
                .hasMessageContaining("source content changed");
        assertThatThrownBy(() -> started.validateFor("hash", "other", 3))
                .isInstanceOf(ConfigMismatchException.class)
                .hasMessageContaining("translation settings changed");
        assertThatThrownBy(() -> started.validateFor("hash", "fingerprint", 4))
                .isInstanceOf(ConfigMismatchException.class)
                .hasMessage("unit count changed from 3 to 4");
    }
}
