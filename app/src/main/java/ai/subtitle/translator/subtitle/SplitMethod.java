package ai.subtitle.translator.subtitle;

import java.util.Locale;

/**
 * Strategy used to break translated text into display rows.
 */
public enum SplitMethod {
    WORD,
    CHAR,
    EVEN;

    public static SplitMethod from(String raw) {
        if (raw == null || raw.isBlank()) {
            return EVEN;
        }
        for (SplitMethod method : values()) {
            if (method.name().equalsIgnoreCase(raw.trim())) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unsupported split method: " + raw);
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
