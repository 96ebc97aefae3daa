package ai.subtitle.translator.subtitle;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A single subtitle block. Index, timing and source lines are fixed at parse time; only the
 * translated text can be attached afterwards.
 */
public final class SubtitleEntry {

    private final int index;
    private final long startMillis;
    private final long endMillis;
    private final List<String> lines;
    private final String indexLine;
    private final String timingLine;
    private String translatedText;
    private boolean flagged;

    public SubtitleEntry(int index, long startMillis, long endMillis, List<String> lines) {
        this(index, startMillis, endMillis, lines, Integer.toString(index), Timecode.formatRange(startMillis, endMillis));
    }

    SubtitleEntry(int index, long startMillis, long endMillis, List<String> lines, String indexLine, String timingLine) {
        if (index < 1) {
            throw new IllegalArgumentException("index must be 1 or greater");
        }
        if (startMillis < 0 || startMillis >= endMillis) {
            throw new IllegalArgumentException("start must be before end for entry " + index);
        }
        this.lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        if (this.lines.isEmpty()) {
            throw new IllegalArgumentException("entry " + index + " has no text");
        }
        this.index = index;
        this.startMillis = startMillis;
        this.endMillis = endMillis;
        this.indexLine = Objects.requireNonNull(indexLine, "indexLine");
        this.timingLine = Objects.requireNonNull(timingLine, "timingLine");
    }

    public static SubtitleEntry of(int index, long startMillis, long endMillis, String text) {
        return new SubtitleEntry(index, startMillis, endMillis, Arrays.asList(text.split("\\R")));
    }

    public int index() {
        return index;
    }

    public long startMillis() {
        return startMillis;
    }

    public long endMillis() {
        return endMillis;
    }

    public long durationMillis() {
        return endMillis - startMillis;
    }

    public List<String> lines() {
        return lines;
    }

    public String text() {
        return String.join("\n", lines);
    }

    public List<FormattingSpan> formattingSpans() {
        return FormattingMarkup.extract(lines, false).spans();
    }

    public Optional<String> translatedText() {
        return Optional.ofNullable(translatedText);
    }

    public boolean hasTranslation() {
        return translatedText != null;
    }

    public void attachTranslation(String text) {
        this.translatedText = Objects.requireNonNull(text, "text");
    }

    /**
     * Marks an entry whose share of a cross-entry translation could not be separated from the
     * preceding entry.
     */
    public void flag() {
        this.flagged = true;
    }

    public boolean isFlagged() {
        return flagged;
    }

    String indexLine() {
        return indexLine;
    }

    String timingLine() {
        return timingLine;
    }

    @Override
    public String toString() {
        return "SubtitleEntry[" + index + " " + timingLine.strip() + " " + text().replace('\n', '|') + "]";
    }
}
