package ai.subtitle.translator.grouping;

import static org.assertj.core.api.Assertions.assertThat;

import ai.subtitle.translator.subtitle.SubtitleEntry;
import java.util.List;
import org.junit.jupiter.api.Test;

class GroupReassemblerTest {

    private final CrossEntryGrouper grouper = new CrossEntryGrouper(GroupingRules.defaults(), true);
    private final GroupReassembler reassembler = new GroupReassembler();

    @Test
    void reinsertsMarkupIntoEachShare() {
        CrossEntryGroup group = grouper.group(List.of(
                SubtitleEntry.of(1, 0, 1_000, "<i>I never said</i>"),
                SubtitleEntry.of(2, 1_000, 2_000, "<i>that he was guilty.</i>"))).get(0);

        GroupReassembler.Reassembly reassembly = reassembler.reassemble(group, "Je n'ai jamais dit qu'il était coupable.");

        assertThat(reassembly.fallback()).isFalse();
        assertThat(reassembly.texts()).hasSize(2).allSatisfy(text -> {
            assertThat(text).startsWith("<i>");
            assertThat(text).endsWith("</i>");
        });
        assertThat(String.join(" ", reassembly.texts()).replace("<i>", "").replace("</i>", ""))
                .isEqualTo("Je n'ai jamais dit qu'il était coupable.");
    }

    @Test
    void fallsBackToFirstEntryAndFlagsTheRest() {
        List<SubtitleEntry> entries = List.of(
                SubtitleEntry.of(1, 0, 1_000, "Are you"),
                SubtitleEntry.of(2, 1_000, 2_000, "really going"),
                SubtitleEntry.of(3, 2_000, 3_000, "to do that?"));
        CrossEntryGroup group = grouper.group(entries).get(0);

        int flagged = reassembler.apply(group, "Vraiment ?");

        assertThat(flagged).isEqualTo(2);
        assertThat(entries.get(0).translatedText()).contains("Vraiment ?");
        assertThat(entries.get(1).translatedText()).contains(GroupReassembler.CONTINUATION_MARKER);
        assertThat(entries.get(1).isFlagged()).isTrue();
        assertThat(entries.get(2).isFlagged()).isTrue();
        assertThat(entries.get(0).isFlagged()).isFalse();
    }

    @Test
    void attachesSharesToEveryMember() {
        List<SubtitleEntry> entries = List.of(
                SubtitleEntry.of(1, 0, 1_000, "This is now"),
                SubtitleEntry.of(2, 1_000, 2_000, "an NYPD homicide investigation,"),
                SubtitleEntry.of(3, 2_000, 3_000, "so if we collar Hughes, we'll let you know."));
        CrossEntryGroup group = grouper.group(entries).get(0);
        String translated = "C'est désormais une enquête criminelle du NYPD, alors si on arrête Hughes, on vous le dira.";

        int flagged = reassembler.apply(group, translated);

        assertThat(flagged).isZero();
        assertThat(entries).allSatisfy(entry -> assertThat(entry.translatedText()).isPresent());
        assertThat(entries.stream().map(entry -> entry.translatedText().orElseThrow()).toList())
                .allSatisfy(text -> assertThat(text).isNotBlank());
        assertThat(String.join(" ", entries.stream().map(entry -> entry.translatedText().orElseThrow()).toList()))
                .isEqualTo(translated);
    }
}
