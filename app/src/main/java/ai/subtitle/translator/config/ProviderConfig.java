package ai.subtitle.translator.config;

import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the ordered provider fallback list.
 */
public record ProviderConfig(LlmProvider provider, String modelName, Optional<String> baseUrl) {

    public ProviderConfig {
        provider = Objects.requireNonNull(provider, "provider");
        modelName = requireNonBlank(modelName, "modelName");
        baseUrl = baseUrl == null ? Optional.empty() : baseUrl;
    }

    /**
     * Parses {@code provider[:model]}. Ollama model names may themselves contain a colon
     * ({@code llama3.1:8b}), so only the first colon separates provider from model.
     */
    public static ProviderConfig parse(String raw, Optional<String> ollamaBaseUrl) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Provider entry must not be blank");
        }
        String value = raw.trim();
        int separator = value.indexOf(':');
        LlmProvider provider = LlmProvider.from(separator < 0 ? value : value.substring(0, separator));
        String model = separator < 0 ? "" : value.substring(separator + 1).trim();
        if (model.isEmpty()) {
            model = provider.defaultModel();
        }
        Optional<String> baseUrl = provider == LlmProvider.OLLAMA ? ollamaBaseUrl : Optional.empty();
        return new ProviderConfig(provider, model, baseUrl);
    }

    public boolean isOllama() {
        return provider == LlmProvider.OLLAMA;
    }

    public String label() {
        return provider.id() + ":" + modelName;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
