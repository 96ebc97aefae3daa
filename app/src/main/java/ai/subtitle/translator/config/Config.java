package ai.subtitle.translator.config;

import ai.subtitle.translator.engine.ExecutionSettings;
import ai.subtitle.translator.engine.ProcessingMode;
import ai.subtitle.translator.engine.RetryPolicy;
import ai.subtitle.translator.grouping.GroupingRules;
import ai.subtitle.translator.subtitle.RowReflow;
import ai.subtitle.translator.subtitle.SplitMethod;
import ai.subtitle.translator.translate.TranslationMode;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        String sourceLanguage,
        String targetLanguage,
        ProcessingMode processingMode,
        TranslationMode translationMode,
        int batchSize,
        int overlapSize,
        boolean overlapReassessment,
        int maxRowLength,
        SplitMethod splitMethod,
        boolean crossEntryDetection,
        long continuityGapMillis,
        List<String> dialogueMarkers,
        int maxGroupSize,
        int contextWindow,
        int wholeFileMaxUnits,
        List<ProviderConfig> providers,
        Secrets secrets,
        int llmMaxRetryAttempts,
        int llmTimeoutSeconds,
        int llmInitialBackoffSeconds,
        int llmMaxBackoffSeconds,
        double llmRetryJitterFactor,
        String failedPlaceholder,
        int parallelism,
        LogFormat logFormat
) {

    public Config {
        sourceLanguage = normalizeLanguage(sourceLanguage, "sourceLanguage");
        targetLanguage = normalizeLanguage(targetLanguage, "targetLanguage");
        Objects.requireNonNull(processingMode, "processingMode");
        Objects.requireNonNull(translationMode, "translationMode");
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (overlapSize < 0) {
            throw new IllegalArgumentException("overlapSize must be zero or greater");
        }
        if (maxRowLength < 0) {
            throw new IllegalArgumentException("maxRowLength must be zero or greater");
        }
        Objects.requireNonNull(splitMethod, "splitMethod");
        if (continuityGapMillis < 0) {
            throw new IllegalArgumentException("continuityGapMillis must be zero or greater");
        }
        dialogueMarkers = dialogueMarkers == null || dialogueMarkers.isEmpty()
                ? GroupingRules.DEFAULT_DIALOGUE_MARKERS
                : List.copyOf(dialogueMarkers);
        if (maxGroupSize < 1) {
            throw new IllegalArgumentException("maxGroupSize must be at least 1");
        }
        if (contextWindow < 0) {
            throw new IllegalArgumentException("contextWindow must be zero or greater");
        }
        if (wholeFileMaxUnits < 1) {
            throw new IllegalArgumentException("wholeFileMaxUnits must be at least 1");
        }
        providers = List.copyOf(Objects.requireNonNull(providers, "providers"));
        if (translationMode == TranslationMode.PRODUCTION && providers.isEmpty()) {
            throw new IllegalArgumentException("at least one provider is required in production mode");
        }
        secrets = secrets == null ? Secrets.none() : secrets;
        if (llmTimeoutSeconds < 1) {
            throw new IllegalArgumentException("llmTimeoutSeconds must be at least 1");
        }
        failedPlaceholder = failedPlaceholder == null ? "" : failedPlaceholder;
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        Objects.requireNonNull(logFormat, "logFormat");
    }

    public GroupingRules groupingRules() {
        return GroupingRules.defaults()
                .withContinuityGapMillis(continuityGapMillis)
                .withDialogueMarkers(dialogueMarkers)
                .withMaxGroupSize(maxGroupSize);
    }

    public RowReflow rowReflow() {
        return new RowReflow(maxRowLength, splitMethod);
    }

    public ExecutionSettings executionSettings() {
        return new ExecutionSettings(processingMode, sourceLanguage, targetLanguage, batchSize, overlapSize,
                overlapReassessment, contextWindow, wholeFileMaxUnits);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(llmMaxRetryAttempts, Duration.ofSeconds(llmTimeoutSeconds), llmInitialBackoffSeconds,
                llmMaxBackoffSeconds, llmRetryJitterFactor);
    }

    private static String normalizeLanguage(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
