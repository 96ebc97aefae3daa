package ai.subtitle.translator.subtitle;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Separates inline formatting markup (HTML-style tags and ASS override blocks) from subtitle
 * text so that only the plain text is sent for translation.
 */
public final class FormattingMarkup {

    private static final Pattern TAG = Pattern.compile("<\\s*/?\\s*[a-zA-Z][^<>]*>|\\{\\\\[^{}]*\\}");

    private FormattingMarkup() {
    }

    public static boolean containsMarkup(String text) {
        return text != null && TAG.matcher(text).find();
    }

    public static String strip(String text) {
        return text == null ? "" : TAG.matcher(text).replaceAll("");
    }

    /**
     * Strips markup from the given lines. Lines are trimmed and joined with a space, or with a
     * line feed when {@code keepLineBreaks} is set.
     */
    public static MarkupExtraction extract(List<String> lines, boolean keepLineBreaks) {
        List<String> trimmed = new ArrayList<>(lines.size());
        for (String line : lines) {
            String value = line.strip();
            if (!value.isEmpty()) {
                trimmed.add(value);
            }
        }
        String joined = String.join(keepLineBreaks ? "\n" : " ", trimmed);

        StringBuilder plain = new StringBuilder(joined.length());
        List<String> tags = new ArrayList<>();
        List<Integer> offsets = new ArrayList<>();
        Matcher matcher = TAG.matcher(joined);
        int cursor = 0;
        while (matcher.find()) {
            plain.append(joined, cursor, matcher.start());
            tags.add(matcher.group());
            offsets.add(plain.length());
            cursor = matcher.end();
        }
        plain.append(joined.substring(cursor));

        collapseReopenedTags(plain, tags, offsets);
        return anchor(plain.toString(), tags, offsets);
    }

    /**
     * Puts the tags back into {@code plainText}. Tags anchored strictly inside the text snap to
     * the nearest word boundary: opening tags before a word, closing tags after one.
     */
    public static String reinsert(String plainText, List<FormattingSpan> spans) {
        if (spans == null || spans.isEmpty() || plainText == null) {
            return plainText;
        }
        int length = plainText.length();
        List<int[]> placements = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            FormattingSpan span = spans.get(i);
            int position;
            if (span.relativePosition() <= 0.0) {
                position = 0;
            } else if (span.relativePosition() >= 1.0) {
                position = length;
            } else {
                int target = (int) Math.round(span.relativePosition() * length);
                position = span.isClosing() ? nearestWordEnd(plainText, target) : nearestWordStart(plainText, target);
            }
            placements.add(new int[] {position, i});
        }
        placements.sort(Comparator.<int[]>comparingInt(p -> p[0]).thenComparingInt(p -> p[1]));

        StringBuilder result = new StringBuilder(length + spans.size() * 4);
        int cursor = 0;
        for (int[] placement : placements) {
            result.append(plainText, cursor, placement[0]);
            result.append(spans.get(placement[1]).tag());
            cursor = placement[0];
        }
        result.append(plainText.substring(cursor));
        return result.toString();
    }

    // "</i> <i>" and "</i>\n<i>" carry no information once the lines are joined
    private static void collapseReopenedTags(StringBuilder plain, List<String> tags, List<Integer> offsets) {
        int i = 0;
        while (i < tags.size() - 1) {
            String current = tags.get(i);
            String next = tags.get(i + 1);
            String between = plain.substring(offsets.get(i), offsets.get(i + 1));
            if (current.startsWith("</") && next.equalsIgnoreCase("<" + current.substring(2)) && between.isBlank()) {
                tags.remove(i + 1);
                offsets.remove(i + 1);
                tags.remove(i);
                offsets.remove(i);
            } else {
                i++;
            }
        }
    }

    private static MarkupExtraction anchor(String plain, List<String> tags, List<Integer> offsets) {
        int leading = plain.length() - plain.stripLeading().length();
        String text = plain.strip();
        int length = text.length();
        List<FormattingSpan> spans = new ArrayList<>(tags.size());
        for (int i = 0; i < tags.size(); i++) {
            int offset = Math.max(0, Math.min(length, offsets.get(i) - leading));
            double relative = length == 0 ? 0.0 : (double) offset / length;
            spans.add(new FormattingSpan(tags.get(i), relative));
        }
        return new MarkupExtraction(text, spans);
    }

    private static int nearestWordStart(String text, int target) {
        return nearest(text, target, true);
    }

    private static int nearestWordEnd(String text, int target) {
        return nearest(text, target, false);
    }

    private static int nearest(String text, int target, boolean wordStart) {
        int length = text.length();
        for (int distance = 0; distance <= length; distance++) {
            int before = target - distance;
            if (before >= 0 && before <= length && isBoundary(text, before, wordStart)) {
                return before;
            }
            int after = target + distance;
            if (after >= 0 && after <= length && isBoundary(text, after, wordStart)) {
                return after;
            }
        }
        return wordStart ? 0 : length;
    }

    private static boolean isBoundary(String text, int position, boolean wordStart) {
        int length = text.length();
        if (wordStart) {
            return position == 0 || (position < length
                    && !Character.isWhitespace(text.charAt(position))
                    && Character.isWhitespace(text.charAt(position - 1)));
        }
        return position == length || (position > 0
                && Character.isWhitespace(text.charAt(position))
                && !Character.isWhitespace(text.charAt(position - 1)));
    }
}
