package ai.subtitle.translator.translate;

import java.util.Objects;

/**
 * Provider output for one unit.
 */
public record TranslatedUnit(int unitId, String text) {

    public TranslatedUnit {
        Objects.requireNonNull(text, "text");
    }
}
