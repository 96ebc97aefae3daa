package ai.subtitle.translator.grouping;

import static org.assertj.core.api.Assertions.assertThat;

import ai.subtitle.translator.subtitle.SubtitleEntry;
import ai.subtitle.translator.subtitle.SubtitleParser;
import java.util.List;
import org.junit.jupiter.api.Test;

class CrossEntryGrouperTest {

    private final CrossEntryGrouper grouper = new CrossEntryGrouper(GroupingRules.defaults(), true);

    @Test
    void mergesSentenceSpreadOverThreeEntries() {
        String content = """
                1
                00:00:01,000 --> 00:00:02,000
                This is now

                2
                00:00:02,100 --> 00:00:04,000
                an NYPD homicide
                investigation,

                3
                00:00:04,200 --> 00:00:07,000
                so if we collar Hughes, we'll let you know.

                4
                00:00:08,000 --> 00:00:09,000
                Thank you.
                """;

        List<CrossEntryGroup> groups = grouper.group(new SubtitleParser().parse(content));

        assertThat(groups).hasSize(2);
        CrossEntryGroup sentence = groups.get(0);
        assertThat(sentence.unitId()).isZero();
        assertThat(sentence.entryIndices()).containsExactly(1, 2, 3);
        assertThat(sentence.isCrossEntry()).isTrue();
        assertThat(sentence.sourceText())
                .isEqualTo("This is now an NYPD homicide investigation, so if we collar Hughes, we'll let you know.");
        assertThat(sentence.weights()).containsExactly(11, 31, 43);
        assertThat(groups.get(1).entryIndices()).containsExactly(4);
        assertThat(groups.get(1).unitId()).isEqualTo(1);
    }

    @Test
    void dialogueEntryNeverMergesWithItsNeighbour() {
        SubtitleEntry dialogue = SubtitleEntry.of(1, 0, 1_000, "- Have you seen my daughter?\n- No.");
        SubtitleEntry following = SubtitleEntry.of(2, 1_100, 2_000, "She was wearing a red coat");
        SubtitleEntry openBefore = SubtitleEntry.of(3, 2_100, 3_000, "Wait for");
        SubtitleEntry dashedAfter = SubtitleEntry.of(4, 3_100, 4_000, "— me here");

        assertThat(grouper.continuesInto(dialogue, following)).isFalse();
        assertThat(grouper.continuesInto(openBefore, dashedAfter)).isFalse();

        List<CrossEntryGroup> groups = grouper.group(List.of(dialogue, following));
        assertThat(groups).extracting(CrossEntryGroup::size).containsExactly(1, 1);
        assertThat(groups.get(0).sourceText()).isEqualTo("- Have you seen my daughter?\n- No.");
    }

    @Test
    void gapAboveThresholdBreaksTheSentence() {
        SubtitleEntry first = SubtitleEntry.of(1, 0, 1_000, "And then");
        SubtitleEntry late = SubtitleEntry.of(2, 2_500, 3_000, "nothing happened.");

        assertThat(grouper.continuesInto(first, late)).isFalse();
        assertThat(new CrossEntryGrouper(GroupingRules.defaults().withContinuityGapMillis(2_000), true)
                .continuesInto(first, late)).isTrue();
    }

    @Test
    void overlappingEntriesCountAsZeroGap() {
        SubtitleEntry first = SubtitleEntry.of(1, 0, 2_000, "And then");
        SubtitleEntry overlapping = SubtitleEntry.of(2, 1_500, 3_000, "nothing happened.");

        assertThat(grouper.continuesInto(first, overlapping)).isTrue();
    }

    @Test
    void maximumGroupSizeClosesTheGroup() {
        CrossEntryGrouper limited = new CrossEntryGrouper(GroupingRules.defaults().withMaxGroupSize(3), true);
        List<SubtitleEntry> entries = List.of(
                SubtitleEntry.of(1, 0, 1_000, "one"),
                SubtitleEntry.of(2, 1_000, 2_000, "two"),
                SubtitleEntry.of(3, 2_000, 3_000, "three"),
                SubtitleEntry.of(4, 3_000, 4_000, "four."));

        assertThat(limited.group(entries)).extracting(CrossEntryGroup::entryIndices)
                .containsExactly(List.of(1, 2, 3), List.of(4));
    }

    @Test
    void disabledDetectionKeepsEveryEntryAlone() {
        CrossEntryGrouper disabled = new CrossEntryGrouper(GroupingRules.defaults(), false);
        List<SubtitleEntry> entries = List.of(
                SubtitleEntry.of(1, 0, 1_000, "This is now"),
                SubtitleEntry.of(2, 1_000, 2_000, "the end."));

        assertThat(disabled.group(entries)).extracting(CrossEntryGroup::size).containsExactly(1, 1);
    }

    @Test
    void stripsMarkupBeforeJoiningMembers() {
        List<SubtitleEntry> entries = List.of(
                SubtitleEntry.of(1, 0, 1_000, "<i>I never said</i>"),
                SubtitleEntry.of(2, 1_000, 2_000, "<i>that he was guilty.</i>"));

        List<CrossEntryGroup> groups = grouper.group(entries);

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0).sourceText()).isEqualTo("I never said that he was guilty.");
    }
}
