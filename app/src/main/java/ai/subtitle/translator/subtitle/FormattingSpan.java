package ai.subtitle.translator.subtitle;

import java.util.Objects;

/**
 * An inline formatting tag removed from subtitle text, anchored at a relative position of the
 * remaining plain text ({@code 0.0} = before the first character, {@code 1.0} = after the last).
 */
public record FormattingSpan(String tag, double relativePosition) {

    public FormattingSpan {
        Objects.requireNonNull(tag, "tag");
        if (tag.isEmpty()) {
            throw new IllegalArgumentException("tag must not be empty");
        }
        if (relativePosition < 0.0 || relativePosition > 1.0) {
            throw new IllegalArgumentException("relativePosition must be between 0.0 and 1.0");
        }
    }

    public boolean isClosing() {
        return tag.startsWith("</");
    }
}
