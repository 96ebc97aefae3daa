package ai.subtitle.translator.translate;

import java.util.Locale;

/**
 * Resolves language codes such as {@code en} or {@code hu} to English display names for prompts.
 */
public final class LanguageNames {

    private LanguageNames() {
    }

    public static String displayName(String code) {
        if (code == null || code.isBlank()) {
            return "";
        }
        String trimmed = code.trim();
        String name = Locale.forLanguageTag(trimmed.replace('_', '-')).getDisplayLanguage(Locale.ENGLISH);
        if (name == null || name.isBlank() || name.equalsIgnoreCase(trimmed)) {
            return trimmed.length() <= 3 ? trimmed.toUpperCase(Locale.ROOT) : trimmed;
        }
        return name;
    }
}
