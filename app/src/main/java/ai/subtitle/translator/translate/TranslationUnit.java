package ai.subtitle.translator.translate;

import java.util.Objects;

/**
 * One unit submitted to a provider: the source text of a sentence group plus optional
 * surrounding dialogue the provider may use but must not translate.
 */
public record TranslationUnit(int unitId, String text, String context) {

    public TranslationUnit {
        if (unitId < 0) {
            throw new IllegalArgumentException("unitId must be zero or greater");
        }
        Objects.requireNonNull(text, "text");
        context = context == null ? "" : context;
    }

    public TranslationUnit(int unitId, String text) {
        this(unitId, text, "");
    }
}
