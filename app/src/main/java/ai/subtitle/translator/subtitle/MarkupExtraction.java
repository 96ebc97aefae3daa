package ai.subtitle.translator.subtitle;

import java.util.List;
import java.util.Objects;

/**
 * Plain text of a subtitle entry together with the formatting tags stripped from it.
 */
public record MarkupExtraction(String plainText, List<FormattingSpan> spans) {

    public MarkupExtraction {
        Objects.requireNonNull(plainText, "plainText");
        spans = List.copyOf(Objects.requireNonNull(spans, "spans"));
    }

    public boolean hasMarkup() {
        return !spans.isEmpty();
    }

    public String reinsert(String translatedPlainText) {
        return FormattingMarkup.reinsert(translatedPlainText, spans);
    }
}
