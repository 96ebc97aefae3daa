package ai.subtitle.translator.subtitle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses SubRip content into a {@link SubtitleDocument}.
 */
public class SubtitleParser {

    private static final char BOM = '\uFEFF';

    public SubtitleDocument parse(Path path) {
        try {
            return parse(Files.readAllBytes(path));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read subtitle file: " + path, ex);
        }
    }

    public SubtitleDocument parse(byte[] content) {
        return parse(new String(content, StandardCharsets.UTF_8));
    }

    public SubtitleDocument parse(String content) {
        if (content == null) {
            throw new SubtitleParseException("Subtitle content must not be null", -1);
        }
        String text = !content.isEmpty() && content.charAt(0) == BOM ? content.substring(1) : content;
        SplitLines split = splitLines(text);
        List<String> lines = split.lines();

        List<String> leading = new ArrayList<>();
        int cursor = 0;
        while (cursor < lines.size() && lines.get(cursor).isBlank()) {
            leading.add(lines.get(cursor));
            cursor++;
        }

        List<SubtitleEntry> entries = new ArrayList<>();
        List<List<String>> separators = new ArrayList<>();
        Set<Integer> seenIndices = new HashSet<>();
        while (cursor < lines.size()) {
            int indexLineNumber = cursor + 1;
            String indexLine = lines.get(cursor);
            int index = parseIndex(indexLine, indexLineNumber);
            if (!seenIndices.add(index)) {
                throw new SubtitleParseException("Duplicate subtitle index " + index, indexLineNumber);
            }
            cursor++;

            if (cursor >= lines.size() || lines.get(cursor).isBlank()) {
                throw new SubtitleParseException("Missing time range for subtitle " + index, cursor + 1);
            }
            String timingLine = lines.get(cursor);
            long[] range = parseRange(timingLine, cursor + 1);
            if (range[0] >= range[1]) {
                throw new SubtitleParseException("Start time must be before end time for subtitle " + index, cursor + 1);
            }
            cursor++;

            List<String> textLines = new ArrayList<>();
            while (cursor < lines.size() && !lines.get(cursor).isBlank()) {
                textLines.add(lines.get(cursor));
                cursor++;
            }
            if (textLines.isEmpty()) {
                throw new SubtitleParseException("Subtitle " + index + " has no text", cursor + 1);
            }

            List<String> separator = new ArrayList<>();
            while (cursor < lines.size() && lines.get(cursor).isBlank()) {
                separator.add(lines.get(cursor));
                cursor++;
            }
            entries.add(new SubtitleEntry(index, range[0], range[1], textLines, indexLine, timingLine));
            separators.add(separator);
        }

        if (entries.isEmpty()) {
            throw new SubtitleParseException("No subtitle entries found", -1);
        }
        return new SubtitleDocument(entries, leading, separators, split.separator(), split.endsWithLineBreak());
    }

    private int parseIndex(String line, int lineNumber) {
        String value = line.strip();
        try {
            int index = Integer.parseInt(value);
            if (index < 1) {
                throw new SubtitleParseException("Subtitle index must be 1 or greater: " + value, lineNumber);
            }
            return index;
        } catch (NumberFormatException ex) {
            throw new SubtitleParseException("Invalid subtitle index: " + value, lineNumber);
        }
    }

    private long[] parseRange(String line, int lineNumber) {
        try {
            return Timecode.parseRange(line);
        } catch (IllegalArgumentException ex) {
            throw new SubtitleParseException("Invalid time range: " + line.strip(), lineNumber);
        }
    }

    private SplitLines splitLines(String text) {
        List<String> lines = new ArrayList<>();
        String separator = null;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '\r' || ch == '\n') {
                lines.add(text.substring(start, i));
                String found = ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n' ? "\r\n" : String.valueOf(ch);
                if (separator == null) {
                    separator = found;
                }
                i += found.length();
                start = i;
            } else {
                i++;
            }
        }
        boolean endsWithLineBreak = start == text.length() && !text.isEmpty();
        if (!endsWithLineBreak && start < text.length()) {
            lines.add(text.substring(start));
        }
        return new SplitLines(lines, separator == null ? "\n" : separator, endsWithLineBreak);
    }

    private record SplitLines(List<String> lines, String separator, boolean endsWithLineBreak) {
    }
}
