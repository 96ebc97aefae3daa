package ai.subtitle.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.subtitle.translator.cli.CliArguments;
import ai.subtitle.translator.config.Config;
import ai.subtitle.translator.config.ConfigLoader;
import ai.subtitle.translator.config.LlmProvider;
import ai.subtitle.translator.config.ProviderConfig;
import ai.subtitle.translator.config.Secrets;
import dev.langchain4j.model.chat.ChatModel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ProviderFactoryTest {

    @Test
    void mockModeUsesMockProvider() {
        List<TranslationProvider> providers = new ProviderFactory().create(config(Map.of(), "--translation-mode", "mock"));

        assertThat(providers).singleElement().isInstanceOf(MockTranslationProvider.class);
        List<TranslatedUnit> result = providers.get(0).translate(
                new TranslationRequest("en", "fr", List.of(new TranslationUnit(2, "Hello."))));
        assertThat(result).containsExactly(new TranslatedUnit(2, "[MOCK] Hello."));
    }

    @Test
    void dryRunEchoesSource() {
        List<TranslationProvider> providers = new ProviderFactory().create(config(Map.of(), "--translation-mode", "dry-run"));

        assertThat(providers).singleElement().isInstanceOf(PassThroughTranslationProvider.class);
        assertThat(providers.get(0).translate(new TranslationRequest("en", "fr", List.of(new TranslationUnit(0, "Hi.")))))
                .containsExactly(new TranslatedUnit(0, "Hi."));
    }

    @Test
    void productionModeKeepsConfiguredProviderOrder() {
        List<ProviderConfig> requested = new ArrayList<>();
        List<Duration> timeouts = new ArrayList<>();
        ProviderFactory factory = new ProviderFactory() {
            @Override
            protected ChatModel createChatModel(ProviderConfig providerConfig, Secrets secrets, Duration timeout) {
                requested.add(providerConfig);
                timeouts.add(timeout);
                return new ChatModel() {
                    @Override
                    public String chat(String prompt) {
                        return "[0] ok";
                    }
                };
            }
        };

        List<TranslationProvider> providers = factory.create(config(Map.of(),
                "--provider", "gemini", "--provider", "ollama:qwen2.5:7b", "--timeout", "30"));

        assertThat(providers).extracting(TranslationProvider::name)
                .containsExactly("gemini:" + LlmProvider.GEMINI.defaultModel(), "ollama:qwen2.5:7b");
        assertThat(requested).extracting(ProviderConfig::provider).containsExactly(LlmProvider.GEMINI, LlmProvider.OLLAMA);
        assertThat(timeouts).containsOnly(Duration.ofSeconds(35));
    }

    @Test
    void geminiRequiresApiKey() {
        Config config = config(Map.of(), "--provider", "gemini");

        assertThatThrownBy(() -> new ProviderFactory().create(config))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GEMINI_API_KEY");
    }

    @Test
    void buildsRealChatModelsFromConfiguration() {
        Config config = config(Map.of("GEMINI_API_KEY", "test-key"), "--provider", "ollama", "--provider", "gemini");

        List<TranslationProvider> providers = new ProviderFactory().create(config);

        assertThat(providers).hasSize(2).allSatisfy(provider ->
                assertThat(provider).isInstanceOf(ChatModelTranslationProvider.class));
    }

    private static Config config(Map<String, String> env, String... extraArgs) {
        List<String> args = new ArrayList<>(List.of("--target", "fr"));
        args.addAll(List.of(extraArgs));
        args.add("movie.srt");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), args.toArray(String[]::new));
        return new ConfigLoader(key -> Optional.ofNullable(env.get(key))).load(cliArguments);
    }
}
