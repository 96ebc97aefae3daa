package ai.subtitle.translator.translate;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered units for a single provider call.
 *
 * @param priorTranslations already translated units passed along for consistency only; the
 *                          provider does not return them
 */
public record TranslationRequest(String sourceLanguage,
                                 String targetLanguage,
                                 List<TranslationUnit> units,
                                 List<PriorTranslation> priorTranslations) {

    public TranslationRequest {
        sourceLanguage = requireNonBlank(sourceLanguage, "sourceLanguage");
        targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
        units = List.copyOf(Objects.requireNonNull(units, "units"));
        if (units.isEmpty()) {
            throw new IllegalArgumentException("units must not be empty");
        }
        priorTranslations = priorTranslations == null ? List.of() : List.copyOf(priorTranslations);
    }

    public TranslationRequest(String sourceLanguage, String targetLanguage, List<TranslationUnit> units) {
        this(sourceLanguage, targetLanguage, units, List.of());
    }

    public List<Integer> unitIds() {
        return units.stream().map(TranslationUnit::unitId).collect(Collectors.toUnmodifiableList());
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    /**
     * A source sentence together with the translation already stored for it.
     */
    public record PriorTranslation(String source, String translation) {

        public PriorTranslation {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(translation, "translation");
        }
    }
}
