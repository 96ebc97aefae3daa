package ai.subtitle.translator.subtitle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits translated subtitle text into display rows no longer than a maximum width.
 * Hard line breaks in the input are kept; each paragraph is reflowed on its own.
 */
public final class RowReflow {

    private final int maxRowLength;
    private final SplitMethod method;

    public RowReflow(int maxRowLength, SplitMethod method) {
        if (maxRowLength < 0) {
            throw new IllegalArgumentException("maxRowLength must be zero or greater");
        }
        this.maxRowLength = maxRowLength;
        this.method = Objects.requireNonNull(method, "method");
    }

    public static RowReflow disabled() {
        return new RowReflow(0, SplitMethod.WORD);
    }

    public int maxRowLength() {
        return maxRowLength;
    }

    public SplitMethod method() {
        return method;
    }

    public List<String> reflow(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> rows = new ArrayList<>();
        for (String paragraph : text.split("\\R")) {
            String value = paragraph.strip();
            if (value.isEmpty()) {
                continue;
            }
            if (maxRowLength == 0 || value.length() <= maxRowLength) {
                rows.add(value);
                continue;
            }
            switch (method) {
                case WORD -> splitAtWords(value, rows);
                case CHAR -> splitAtChars(value, rows);
                case EVEN -> splitEvenly(value, rows);
            }
        }
        return rows;
    }

    private void splitAtWords(String paragraph, List<String> rows) {
        StringBuilder current = new StringBuilder();
        for (String word : paragraph.split("\\s+")) {
            if (current.length() > 0 && current.length() + 1 + word.length() > maxRowLength) {
                rows.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        if (current.length() > 0) {
            rows.add(current.toString());
        }
    }

    private void splitAtChars(String paragraph, List<String> rows) {
        for (int start = 0; start < paragraph.length(); start += maxRowLength) {
            String row = paragraph.substring(start, Math.min(paragraph.length(), start + maxRowLength)).strip();
            if (!row.isEmpty()) {
                rows.add(row);
            }
        }
    }

    private void splitEvenly(String paragraph, List<String> rows) {
        if (paragraph.length() <= maxRowLength) {
            rows.add(paragraph);
            return;
        }
        int breakIndex = evenBreakIndex(paragraph);
        if (breakIndex < 0) {
            splitAtChars(paragraph, rows);
            return;
        }
        splitEvenly(paragraph.substring(0, breakIndex).stripTrailing(), rows);
        splitEvenly(paragraph.substring(breakIndex + 1).stripLeading(), rows);
    }

    /**
     * Returns the whitespace index that gives the two most even halves, ties going to the
     * candidate closest to the midpoint, or {@code -1} when the paragraph has no usable whitespace.
     */
    static int evenBreakIndex(String paragraph) {
        double midpoint = paragraph.length() / 2.0;
        int best = -1;
        int bestDifference = Integer.MAX_VALUE;
        double bestDistance = Double.MAX_VALUE;
        for (int i = 0; i < paragraph.length(); i++) {
            if (!Character.isWhitespace(paragraph.charAt(i))) {
                continue;
            }
            String left = paragraph.substring(0, i).stripTrailing();
            String right = paragraph.substring(i + 1).stripLeading();
            if (left.isEmpty() || right.isEmpty()) {
                continue;
            }
            int difference = Math.abs(left.length() - right.length());
            double distance = Math.abs(i - midpoint);
            if (difference < bestDifference || (difference == bestDifference && distance < bestDistance)) {
                best = i;
                bestDifference = difference;
                bestDistance = distance;
            }
        }
        return best;
    }
}
