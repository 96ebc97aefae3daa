package ai.subtitle.translator.progress;

import ai.subtitle.translator.config.Config;
import ai.subtitle.translator.config.ProviderConfig;
import java.util.stream.Collectors;

/**
 * Hash of the settings that shape cached unit translations. Output-only settings (row reflow,
 * placeholder text) and operational ones (retries, timeouts, parallelism, logging) are left out,
 * so changing them keeps existing progress usable.
 */
public final class ConfigFingerprint {

    private ConfigFingerprint() {
    }

    public static String of(Config config) {
        return ContentHash.sha256(canonicalForm(config));
    }

    static String canonicalForm(Config config) {
        StringBuilder builder = new StringBuilder();
        append(builder, "sourceLanguage", config.sourceLanguage());
        append(builder, "targetLanguage", config.targetLanguage());
        append(builder, "processingMode", config.processingMode().name());
        append(builder, "translationMode", config.translationMode().name());
        append(builder, "batchSize", config.batchSize());
        append(builder, "overlapSize", config.overlapSize());
        append(builder, "overlapReassessment", config.overlapReassessment());
        append(builder, "contextWindow", config.contextWindow());
        append(builder, "wholeFileMaxUnits", config.wholeFileMaxUnits());
        append(builder, "crossEntryDetection", config.crossEntryDetection());
        append(builder, "continuityGapMillis", config.continuityGapMillis());
        append(builder, "dialogueMarkers", String.join("\u0000", config.dialogueMarkers()));
        append(builder, "maxGroupSize", config.maxGroupSize());
        append(builder, "providers", config.providers().stream()
                .map(ProviderConfig::label)
                .collect(Collectors.joining(",")));
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        builder.append(key).append('=').append(value).append('\n');
    }
}
