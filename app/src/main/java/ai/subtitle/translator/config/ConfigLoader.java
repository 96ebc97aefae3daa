package ai.subtitle.translator.config;

import ai.subtitle.translator.cli.CliArguments;
import ai.subtitle.translator.engine.ExecutionSettings;
import ai.subtitle.translator.engine.ProcessingMode;
import ai.subtitle.translator.engine.RetryPolicy;
import ai.subtitle.translator.grouping.GroupingRules;
import ai.subtitle.translator.subtitle.RowReflow;
import ai.subtitle.translator.subtitle.SplitMethod;
import ai.subtitle.translator.translate.TranslationMode;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_SOURCE_LANGUAGE = "SOURCE_LANGUAGE";
    static final String ENV_TARGET_LANGUAGE = "TARGET_LANGUAGE";
    static final String ENV_PROCESSING_MODE = "PROCESSING_MODE";
    static final String ENV_TRANSLATION_MODE = "TRANSLATION_MODE";
    static final String ENV_BATCH_SIZE = "BATCH_SIZE";
    static final String ENV_OVERLAP_SIZE = "OVERLAP_SIZE";
    static final String ENV_OVERLAP_REASSESSMENT = "OVERLAP_REASSESSMENT";
    static final String ENV_MAX_ROW_LENGTH = "MAX_ROW_LENGTH";
    static final String ENV_ROW_SPLIT_METHOD = "ROW_SPLIT_METHOD";
    static final String ENV_CROSS_ENTRY_DETECTION = "CROSS_ENTRY_DETECTION";
    static final String ENV_CONTINUITY_GAP_MILLIS = "CONTINUITY_GAP_MILLIS";
    static final String ENV_DIALOGUE_MARKERS = "DIALOGUE_MARKERS";
    static final String ENV_MAX_GROUP_SIZE = "MAX_GROUP_SIZE";
    static final String ENV_CONTEXT_WINDOW = "CONTEXT_WINDOW";
    static final String ENV_WHOLE_FILE_MAX_UNITS = "WHOLE_FILE_MAX_UNITS";
    static final String ENV_LLM_PROVIDERS = "LLM_PROVIDERS";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LLM_MAX_RETRY_ATTEMPTS = "LLM_MAX_RETRY_ATTEMPTS";
    static final String ENV_LLM_TIMEOUT_SECONDS = "LLM_TIMEOUT_SECONDS";
    static final String ENV_LLM_INITIAL_BACKOFF_SECONDS = "LLM_INITIAL_BACKOFF_SECONDS";
    static final String ENV_LLM_MAX_BACKOFF_SECONDS = "LLM_MAX_BACKOFF_SECONDS";
    static final String ENV_LLM_RETRY_JITTER_FACTOR = "LLM_RETRY_JITTER_FACTOR";
    static final String ENV_FAILED_PLACEHOLDER = "FAILED_PLACEHOLDER";
    static final String ENV_PARALLELISM = "PARALLELISM";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_SOURCE_LANGUAGE = "en";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final String DEFAULT_FAILED_PLACEHOLDER = "[TRANSLATION FAILED]";
    private static final int DEFAULT_MAX_ROW_LENGTH = 42;
    private static final int DEFAULT_PARALLELISM = 1;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        String sourceLanguage = firstNonBlank(arguments.sourceLanguage(), ENV_SOURCE_LANGUAGE, DEFAULT_SOURCE_LANGUAGE);
        String targetLanguage = firstNonBlank(arguments.targetLanguage(), ENV_TARGET_LANGUAGE, null);
        if (targetLanguage == null) {
            throw new IllegalArgumentException("target language must be provided (--target or " + ENV_TARGET_LANGUAGE + ")");
        }

        ProcessingMode processingMode = resolve(arguments.processingMode(), ENV_PROCESSING_MODE,
                ProcessingMode::from, ProcessingMode.BATCH);
        TranslationMode translationMode = resolve(arguments.translationMode(), ENV_TRANSLATION_MODE,
                TranslationMode::from, TranslationMode.PRODUCTION);
        LogFormat logFormat = loadLogFormat(arguments);
        SplitMethod splitMethod = resolveSplitMethod(arguments);

        int batchSize = resolveInt(arguments.batchSize(), ENV_BATCH_SIZE, ExecutionSettings.DEFAULT_BATCH_SIZE, 1);
        int overlapSize = resolveInt(arguments.overlapSize(), ENV_OVERLAP_SIZE, ExecutionSettings.DEFAULT_OVERLAP_SIZE, 0);
        boolean overlapReassessment = resolveBoolean(arguments.overlapReassessment(), ENV_OVERLAP_REASSESSMENT, true);
        int maxRowLength = resolveMaxRowLength(arguments);
        boolean crossEntryDetection = resolveBoolean(arguments.crossEntryDetection(), ENV_CROSS_ENTRY_DETECTION, true);
        long continuityGapMillis = resolve(arguments.continuityGapMillis(), ENV_CONTINUITY_GAP_MILLIS,
                raw -> parseLong(raw, ENV_CONTINUITY_GAP_MILLIS), GroupingRules.DEFAULT_CONTINUITY_GAP_MILLIS);
        if (continuityGapMillis < 0) {
            throw new IllegalArgumentException(ENV_CONTINUITY_GAP_MILLIS + " must be zero or greater");
        }
        List<String> dialogueMarkers = resolveList(arguments.dialogueMarkers(), ENV_DIALOGUE_MARKERS)
                .orElse(GroupingRules.DEFAULT_DIALOGUE_MARKERS);
        int maxGroupSize = resolveInt(arguments.maxGroupSize(), ENV_MAX_GROUP_SIZE, GroupingRules.DEFAULT_MAX_GROUP_SIZE, 1);
        int contextWindow = resolveInt(arguments.contextWindow(), ENV_CONTEXT_WINDOW, ExecutionSettings.DEFAULT_CONTEXT_WINDOW, 0);
        int wholeFileMaxUnits = resolveInt(arguments.wholeFileMaxUnits(), ENV_WHOLE_FILE_MAX_UNITS,
                ExecutionSettings.DEFAULT_WHOLE_FILE_MAX_UNITS, 1);

        Optional<String> ollamaBaseUrl = Optional.of(environmentReader.get(ENV_OLLAMA_BASE_URL)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .orElse(DEFAULT_OLLAMA_BASE_URL));
        List<ProviderConfig> providers = resolveList(arguments.providers(), ENV_LLM_PROVIDERS)
                .orElse(List.of(LlmProvider.OLLAMA.id()))
                .stream()
                .map(raw -> ProviderConfig.parse(raw, ollamaBaseUrl))
                .collect(Collectors.toList());
        Secrets secrets = new Secrets(environmentReader.get(ENV_GEMINI_API_KEY).filter(ConfigLoader::isNotBlank));

        int llmMaxRetryAttempts = resolveInt(arguments.maxRetryAttempts(), ENV_LLM_MAX_RETRY_ATTEMPTS,
                RetryPolicy.DEFAULT_MAX_ATTEMPTS, 1);
        int llmTimeoutSeconds = resolveInt(arguments.timeoutSeconds(), ENV_LLM_TIMEOUT_SECONDS,
                (int) RetryPolicy.DEFAULT_CALL_TIMEOUT.toSeconds(), 1);
        int llmInitialBackoffSeconds = resolveInt(null, ENV_LLM_INITIAL_BACKOFF_SECONDS,
                RetryPolicy.DEFAULT_INITIAL_BACKOFF_SECONDS, 0);
        int llmMaxBackoffSeconds = resolveInt(null, ENV_LLM_MAX_BACKOFF_SECONDS,
                RetryPolicy.DEFAULT_MAX_BACKOFF_SECONDS, 0);
        double llmRetryJitterFactor = environmentReader.get(ENV_LLM_RETRY_JITTER_FACTOR)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> parseDouble(raw, ENV_LLM_RETRY_JITTER_FACTOR))
                .orElse(RetryPolicy.DEFAULT_JITTER_FACTOR);

        String failedPlaceholder = arguments.failedPlaceholder() != null
                ? arguments.failedPlaceholder()
                : environmentReader.get(ENV_FAILED_PLACEHOLDER).orElse(DEFAULT_FAILED_PLACEHOLDER);
        int parallelism = resolveInt(arguments.parallelism(), ENV_PARALLELISM, DEFAULT_PARALLELISM, 1);

        return new Config(sourceLanguage, targetLanguage, processingMode, translationMode, batchSize, overlapSize,
                overlapReassessment, maxRowLength, splitMethod, crossEntryDetection, continuityGapMillis,
                dialogueMarkers, maxGroupSize, contextWindow, wholeFileMaxUnits, providers, secrets,
                llmMaxRetryAttempts, llmTimeoutSeconds, llmInitialBackoffSeconds, llmMaxBackoffSeconds,
                llmRetryJitterFactor, failedPlaceholder, parallelism, logFormat);
    }

    /**
     * Resolves the row layout settings alone, for reflowing files without translating them. No
     * language or provider settings are required.
     */
    public RowReflow loadRowReflow(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        return new RowReflow(resolveMaxRowLength(arguments), resolveSplitMethod(arguments));
    }

    public LogFormat loadLogFormat(CliArguments arguments) {
        return resolve(arguments.logFormat(), ENV_LOG_FORMAT, LogFormat::from, LogFormat.TEXT);
    }

    private int resolveMaxRowLength(CliArguments arguments) {
        return resolveInt(arguments.maxRowLength(), ENV_MAX_ROW_LENGTH, DEFAULT_MAX_ROW_LENGTH, 0);
    }

    private SplitMethod resolveSplitMethod(CliArguments arguments) {
        return resolve(arguments.splitMethod(), ENV_ROW_SPLIT_METHOD, SplitMethod::from, SplitMethod.EVEN);
    }

    private <T> T resolve(T cliValue, String envKey, Function<String, T> parser, T defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(raw -> {
                    try {
                        return parser.apply(raw);
                    } catch (IllegalArgumentException ex) {
                        if (ex.getMessage() != null && ex.getMessage().startsWith(envKey)) {
                            throw ex;
                        }
                        throw new IllegalArgumentException(envKey + ": " + ex.getMessage(), ex);
                    }
                })
                .orElse(defaultValue);
    }

    private int resolveInt(Integer cliValue, String envKey, int defaultValue, int minimum) {
        int value = resolve(cliValue, envKey, raw -> parseInteger(raw, envKey), defaultValue);
        if (value < minimum) {
            throw new IllegalArgumentException("%s must be at least %d".formatted(envKey, minimum));
        }
        return value;
    }

    private boolean resolveBoolean(Boolean cliValue, String envKey, boolean defaultValue) {
        return resolve(cliValue, envKey, raw -> parseBoolean(raw, envKey), defaultValue);
    }

    private Optional<List<String>> resolveList(List<String> cliValue, String envKey) {
        if (cliValue != null && !cliValue.isEmpty()) {
            return Optional.of(normalizeList(cliValue));
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(raw -> normalizeList(Arrays.asList(raw.split(","))))
                .filter(values -> !values.isEmpty());
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static List<String> normalizeList(List<String> values) {
        return values.stream()
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInteger(String raw, String key) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static long parseLong(String raw, String key) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean parseBoolean(String raw, String key) {
        if (raw.equalsIgnoreCase("true") || raw.equals("1") || raw.equalsIgnoreCase("yes")) {
            return true;
        }
        if (raw.equalsIgnoreCase("false") || raw.equals("0") || raw.equalsIgnoreCase("no")) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false");
    }

    private static double parseDouble(String raw, String key) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }
}
