package ai.subtitle.translator.grouping;

import ai.subtitle.translator.subtitle.MarkupExtraction;
import ai.subtitle.translator.subtitle.SubtitleEntry;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Consecutive subtitle entries that together form one sentence; the unit of translation.
 *
 * @param unitId      position of the group in the unit sequence, starting at 0
 * @param entries     member entries in display order
 * @param extractions plain text and stripped markup of each member, parallel to {@code entries}
 */
public record CrossEntryGroup(int unitId, List<SubtitleEntry> entries, List<MarkupExtraction> extractions) {

    public CrossEntryGroup {
        if (unitId < 0) {
            throw new IllegalArgumentException("unitId must be zero or greater");
        }
        entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
        extractions = List.copyOf(Objects.requireNonNull(extractions, "extractions"));
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("group must contain at least one entry");
        }
        if (entries.size() != extractions.size()) {
            throw new IllegalArgumentException("extractions must match entries");
        }
    }

    public int size() {
        return entries.size();
    }

    public List<Integer> entryIndices() {
        return entries.stream().map(SubtitleEntry::index).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Member plain texts joined by single spaces.
     */
    public String sourceText() {
        return extractions.stream()
                .map(MarkupExtraction::plainText)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining(" "));
    }

    /**
     * Character length of each member's plain text, used to share out the translation.
     */
    public List<Integer> weights() {
        return extractions.stream()
                .map(extraction -> extraction.plainText().length())
                .collect(Collectors.toUnmodifiableList());
    }

    public boolean isCrossEntry() {
        return entries.size() > 1;
    }
}
