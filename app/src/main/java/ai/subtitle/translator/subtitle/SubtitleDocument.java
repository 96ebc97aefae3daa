package ai.subtitle.translator.subtitle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Parsed subtitle file. Keeps the separators and raw header lines of the source so that a
 * document without translations formats back to the exact input.
 */
public final class SubtitleDocument {

    private final List<SubtitleEntry> entries;
    private final List<String> leadingLines;
    private final List<List<String>> separators;
    private final String lineSeparator;
    private final boolean endsWithLineBreak;

    SubtitleDocument(List<SubtitleEntry> entries,
                     List<String> leadingLines,
                     List<List<String>> separators,
                     String lineSeparator,
                     boolean endsWithLineBreak) {
        this.entries = List.copyOf(entries);
        this.leadingLines = List.copyOf(leadingLines);
        List<List<String>> copies = new ArrayList<>(separators.size());
        for (List<String> separator : separators) {
            copies.add(List.copyOf(separator));
        }
        this.separators = Collections.unmodifiableList(copies);
        if (this.separators.size() != this.entries.size()) {
            throw new IllegalArgumentException("separator count must match entry count");
        }
        this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
        this.endsWithLineBreak = endsWithLineBreak;
    }

    /**
     * Builds a canonical document: entries separated by one blank line, LF line endings.
     */
    public static SubtitleDocument of(List<SubtitleEntry> entries) {
        List<List<String>> separators = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            separators.add(i < entries.size() - 1 ? List.of("") : List.of());
        }
        return new SubtitleDocument(entries, List.of(), separators, "\n", true);
    }

    public List<SubtitleEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public SubtitleEntry entry(int position) {
        return entries.get(position);
    }

    public String lineSeparator() {
        return lineSeparator;
    }

    /**
     * Formats the document, writing translated entries verbatim (hard line breaks only).
     */
    public String format() {
        return format(RowReflow.disabled());
    }

    /**
     * Formats the document, reflowing translated text into display rows. Entries without a
     * translation keep their source lines.
     */
    public String format(RowReflow reflow) {
        Objects.requireNonNull(reflow, "reflow");
        List<String> output = new ArrayList<>(leadingLines);
        for (int i = 0; i < entries.size(); i++) {
            SubtitleEntry entry = entries.get(i);
            output.add(entry.indexLine());
            output.add(entry.timingLine());
            if (entry.hasTranslation()) {
                List<String> rows = reflow.reflow(entry.translatedText().orElseThrow());
                output.addAll(rows.isEmpty() ? entry.lines() : rows);
            } else {
                output.addAll(entry.lines());
            }
            output.addAll(separators.get(i));
        }
        String body = String.join(lineSeparator, output);
        return endsWithLineBreak ? body + lineSeparator : body;
    }
}
