package ai.subtitle.translator.subtitle;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between SubRip timestamps ({@code HH:MM:SS,mmm}) and millisecond offsets.
 */
public final class Timecode {

    static final String ARROW = " --> ";

    private static final Pattern TIMESTAMP = Pattern.compile("(\\d{2,}):(\\d{2}):(\\d{2}),(\\d{3})");
    private static final Pattern RANGE = Pattern.compile(
            "^\\s*(\\d{2,}:\\d{2}:\\d{2},\\d{3})\\s*-->\\s*(\\d{2,}:\\d{2}:\\d{2},\\d{3})(?:\\s.*)?$");

    private Timecode() {
    }

    public static long parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        Matcher matcher = TIMESTAMP.matcher(raw.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid timestamp: " + raw);
        }
        long hours = Long.parseLong(matcher.group(1));
        long minutes = Long.parseLong(matcher.group(2));
        long seconds = Long.parseLong(matcher.group(3));
        long millis = Long.parseLong(matcher.group(4));
        if (minutes > 59 || seconds > 59) {
            throw new IllegalArgumentException("Invalid timestamp: " + raw);
        }
        return ((hours * 60 + minutes) * 60 + seconds) * 1000 + millis;
    }

    public static String format(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("millis must not be negative");
        }
        long hours = millis / 3_600_000;
        long minutes = (millis % 3_600_000) / 60_000;
        long seconds = (millis % 60_000) / 1000;
        long remainder = millis % 1000;
        return String.format("%02d:%02d:%02d,%03d", hours, minutes, seconds, remainder);
    }

    public static String formatRange(long startMillis, long endMillis) {
        return format(startMillis) + ARROW + format(endMillis);
    }

    /**
     * Parses a time-range line into a two element array of {@code [start, end]} millis.
     *
     * @throws IllegalArgumentException when the line is not a SubRip time range
     */
    static long[] parseRange(String line) {
        Matcher matcher = RANGE.matcher(line);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid time range: " + line);
        }
        return new long[] {parse(matcher.group(1)), parse(matcher.group(2))};
    }
}
