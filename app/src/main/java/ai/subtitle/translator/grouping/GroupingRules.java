package ai.subtitle.translator.grouping;

import ai.subtitle.translator.subtitle.FormattingMarkup;
import ai.subtitle.translator.subtitle.SubtitleEntry;
import java.util.List;
import java.util.Objects;

/**
 * Punctuation, speaker-turn and timing rules deciding whether one subtitle entry carries its
 * sentence over into the next.
 */
public record GroupingRules(String terminalPunctuation,
                            String closingCharacters,
                            List<String> dialogueMarkers,
                            long continuityGapMillis,
                            int maxGroupSize) {

    public static final String DEFAULT_TERMINAL_PUNCTUATION = ".!?…";
    public static final String DEFAULT_CLOSING_CHARACTERS = "\"'”’»)]";
    public static final List<String> DEFAULT_DIALOGUE_MARKERS = List.of("-", "–", "—");
    public static final long DEFAULT_CONTINUITY_GAP_MILLIS = 1500;
    public static final int DEFAULT_MAX_GROUP_SIZE = 6;

    public GroupingRules {
        terminalPunctuation = requireNonEmpty(terminalPunctuation, "terminalPunctuation");
        closingCharacters = closingCharacters == null ? "" : closingCharacters;
        dialogueMarkers = List.copyOf(Objects.requireNonNull(dialogueMarkers, "dialogueMarkers"));
        if (dialogueMarkers.stream().anyMatch(String::isBlank)) {
            throw new IllegalArgumentException("dialogueMarkers must not contain blank markers");
        }
        if (continuityGapMillis < 0) {
            throw new IllegalArgumentException("continuityGapMillis must be zero or greater");
        }
        if (maxGroupSize < 1) {
            throw new IllegalArgumentException("maxGroupSize must be at least 1");
        }
    }

    public static GroupingRules defaults() {
        return new GroupingRules(DEFAULT_TERMINAL_PUNCTUATION, DEFAULT_CLOSING_CHARACTERS,
                DEFAULT_DIALOGUE_MARKERS, DEFAULT_CONTINUITY_GAP_MILLIS, DEFAULT_MAX_GROUP_SIZE);
    }

    public GroupingRules withContinuityGapMillis(long gapMillis) {
        return new GroupingRules(terminalPunctuation, closingCharacters, dialogueMarkers, gapMillis, maxGroupSize);
    }

    public GroupingRules withDialogueMarkers(List<String> markers) {
        return new GroupingRules(terminalPunctuation, closingCharacters, markers, continuityGapMillis, maxGroupSize);
    }

    public GroupingRules withMaxGroupSize(int size) {
        return new GroupingRules(terminalPunctuation, closingCharacters, dialogueMarkers, continuityGapMillis, size);
    }

    /**
     * True when the text ends in terminal punctuation, optionally followed by closing quotes or
     * brackets. Markup is ignored; text without any words counts as complete.
     */
    public boolean completesSentence(String text) {
        String plain = FormattingMarkup.strip(text).strip();
        int position = plain.length() - 1;
        while (position >= 0 && closingCharacters.indexOf(plain.charAt(position)) >= 0) {
            position--;
        }
        if (position < 0) {
            return true;
        }
        return terminalPunctuation.indexOf(plain.charAt(position)) >= 0;
    }

    public boolean startsSpeakerTurn(String line) {
        String plain = FormattingMarkup.strip(line).strip();
        for (String marker : dialogueMarkers) {
            if (plain.startsWith(marker)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasSpeakerTurn(SubtitleEntry entry) {
        return entry.lines().stream().anyMatch(this::startsSpeakerTurn);
    }

    private static String requireNonEmpty(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
        return value;
    }
}
