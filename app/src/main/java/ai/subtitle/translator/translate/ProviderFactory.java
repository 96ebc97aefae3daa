package ai.subtitle.translator.translate;

import ai.subtitle.translator.config.Config;
import ai.subtitle.translator.config.ProviderConfig;
import ai.subtitle.translator.config.Secrets;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provides the ordered provider list for the configured translation mode.
 */
public class ProviderFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProviderFactory.class);
    private static final double TEMPERATURE = 0.1;

    public List<TranslationProvider> create(Config config) {
        Objects.requireNonNull(config, "config");
        return switch (config.translationMode()) {
            case MOCK -> List.of(new MockTranslationProvider());
            case DRY_RUN -> List.of(new PassThroughTranslationProvider());
            case PRODUCTION -> config.providers().stream()
                    .map(providerConfig -> createProvider(providerConfig, config))
                    .collect(Collectors.toUnmodifiableList());
        };
    }

    private TranslationProvider createProvider(ProviderConfig providerConfig, Config config) {
        // The caller enforces its own timeout; the model's is a backstop slightly beyond it.
        Duration timeout = Duration.ofSeconds(config.llmTimeoutSeconds() + 5L);
        ChatModel chatModel = createChatModel(providerConfig, config.secrets(), timeout);
        return new ChatModelTranslationProvider(chatModel, providerConfig.provider().id(), providerConfig.modelName());
    }

    protected ChatModel createChatModel(ProviderConfig providerConfig, Secrets secrets, Duration timeout) {
        return switch (providerConfig.provider()) {
            case OLLAMA -> createOllamaChatModel(providerConfig, timeout);
            case GEMINI -> createGeminiChatModel(providerConfig, secrets, timeout);
        };
    }

    private ChatModel createOllamaChatModel(ProviderConfig providerConfig, Duration timeout) {
        String baseUrl = providerConfig.baseUrl()
                .orElseThrow(() -> new IllegalStateException("OLLAMA_BASE_URL must be configured for the ollama provider"));
        try {
            LOGGER.info("Using Ollama model '{}' via {}", providerConfig.modelName(), baseUrl);
            return OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(providerConfig.modelName())
                    .temperature(TEMPERATURE)
                    .timeout(timeout)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }

    private ChatModel createGeminiChatModel(ProviderConfig providerConfig, Secrets secrets, Duration timeout) {
        String apiKey = secrets.geminiApiKey()
                .filter(value -> !value.isBlank())
                .orElseThrow(() -> new IllegalStateException("GEMINI_API_KEY must be provided for the gemini provider"));
        try {
            LOGGER.info("Using Gemini model '{}'", providerConfig.modelName());
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(providerConfig.modelName())
                    .temperature(TEMPERATURE)
                    .timeout(timeout)
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Gemini chat model", ex);
        }
    }
}
