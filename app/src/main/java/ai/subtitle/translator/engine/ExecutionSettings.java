package ai.subtitle.translator.engine;

import java.util.Objects;

/**
 * Settings shared by every processing mode.
 */
public record ExecutionSettings(ProcessingMode mode,
                                String sourceLanguage,
                                String targetLanguage,
                                int batchSize,
                                int overlapSize,
                                boolean overlapReassessment,
                                int contextWindow,
                                int wholeFileMaxUnits) {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int DEFAULT_OVERLAP_SIZE = 2;
    public static final int DEFAULT_CONTEXT_WINDOW = 3;
    public static final int DEFAULT_WHOLE_FILE_MAX_UNITS = 400;

    public ExecutionSettings {
        Objects.requireNonNull(mode, "mode");
        sourceLanguage = requireNonBlank(sourceLanguage, "sourceLanguage");
        targetLanguage = requireNonBlank(targetLanguage, "targetLanguage");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (overlapSize < 0) {
            throw new IllegalArgumentException("overlapSize must be zero or greater");
        }
        if (contextWindow < 0) {
            throw new IllegalArgumentException("contextWindow must be zero or greater");
        }
        if (wholeFileMaxUnits < 1) {
            throw new IllegalArgumentException("wholeFileMaxUnits must be at least 1");
        }
    }

    public static ExecutionSettings defaults(ProcessingMode mode, String sourceLanguage, String targetLanguage) {
        return new ExecutionSettings(mode, sourceLanguage, targetLanguage, DEFAULT_BATCH_SIZE, DEFAULT_OVERLAP_SIZE,
                true, DEFAULT_CONTEXT_WINDOW, DEFAULT_WHOLE_FILE_MAX_UNITS);
    }

    public ExecutionSettings withMode(ProcessingMode newMode) {
        return new ExecutionSettings(newMode, sourceLanguage, targetLanguage, batchSize, overlapSize,
                overlapReassessment, contextWindow, wholeFileMaxUnits);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }
}
