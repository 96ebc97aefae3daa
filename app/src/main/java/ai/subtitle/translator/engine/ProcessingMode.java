package ai.subtitle.translator.engine;

import java.util.Locale;

/**
 * How translation units are packed into provider calls.
 */
public enum ProcessingMode {
    LINE_BY_LINE,
    BATCH,
    WHOLE_FILE;

    public static ProcessingMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return BATCH;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ProcessingMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported processing mode: " + raw);
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
