package ai.subtitle.translator.config;

import java.util.Locale;

/**
 * Supported large language model providers.
 */
public enum LlmProvider {
    GEMINI("models/gemini-1.5-flash-latest"),
    OLLAMA("llama3.1:8b");

    private final String defaultModel;

    LlmProvider(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LlmProvider from(String value) {
        if (value == null) {
            return OLLAMA;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "gemini" -> GEMINI;
            case "ollama", "" -> OLLAMA;
            default -> throw new IllegalArgumentException("Unsupported LLM provider: " + value);
        };
    }
}
