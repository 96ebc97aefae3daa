package ai.subtitle.translator.translate;

import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.model.chat.ChatModel;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Provider backed by a LangChain4j {@link ChatModel} implementation.
 */
public class ChatModelTranslationProvider implements TranslationProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelTranslationProvider.class);

    private final ChatModel model;
    private final String providerName;
    private final String modelName;
    private final NumberedUnitCodec codec;

    public ChatModelTranslationProvider(ChatModel model, String providerName, String modelName) {
        this(model, providerName, modelName, new NumberedUnitCodec());
    }

    ChatModelTranslationProvider(ChatModel model, String providerName, String modelName, NumberedUnitCodec codec) {
        this.model = Objects.requireNonNull(model, "model");
        this.providerName = requireNonBlank(providerName, "providerName");
        this.modelName = requireNonBlank(modelName, "modelName");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public String name() {
        return providerName + ":" + modelName;
    }

    @Override
    public List<TranslatedUnit> translate(TranslationRequest request) {
        String prompt = buildPrompt(request);
        LOGGER.debug("Prompt for units {} via {}:\n{}", request.unitIds(), name(), prompt);
        String response;
        try {
            response = model.chat(prompt);
        } catch (RuntimeException ex) {
            if (isModelMissing(ex)) {
                throw new ProviderException("%s model '%s' is not available.".formatted(providerName, modelName), ex);
            }
            throw new ProviderException("%s translation failed: %s".formatted(providerName, ex.getMessage()), ex);
        }
        LOGGER.debug("Response for units {} via {}:\n{}", request.unitIds(), name(), response);
        return codec.decode(response);
    }

    String buildPrompt(TranslationRequest request) {
        String source = LanguageNames.displayName(request.sourceLanguage());
        String target = LanguageNames.displayName(request.targetLanguage());
        StringBuilder prompt = new StringBuilder();
        prompt.append("""
You are a professional subtitle translator. Translate the numbered subtitle lines below from %s into natural, fluent %s.
Rules:
- Return exactly one output line per input line and keep each [number] marker exactly as given.
- Each numbered line is one complete sentence, even when it is long; translate it as a whole.
- Keep the meaning and tone, and keep translations concise enough to read at subtitle speed.
- Keep every %s marker; it separates lines spoken by different people.
- Do not translate the context sections, do not add commentary, and do not wrap the result in code fences.
""".formatted(source, target, NumberedUnitCodec.LINE_BREAK_TOKEN));

        if (!request.priorTranslations().isEmpty()) {
            prompt.append("\n<PREVIOUS_TRANSLATIONS>\n");
            for (TranslationRequest.PriorTranslation prior : request.priorTranslations()) {
                prompt.append(prior.source().replaceAll("\\R", " ")).append(" => ")
                        .append(prior.translation().replaceAll("\\R", " ")).append('\n');
            }
            prompt.append("</PREVIOUS_TRANSLATIONS>\n");
        }

        String context = request.units().stream()
                .map(TranslationUnit::context)
                .filter(value -> !value.isBlank())
                .collect(Collectors.joining("\n"));
        if (!context.isBlank()) {
            prompt.append("\n<CONTEXT>\n").append(context).append("\n</CONTEXT>\n");
        }

        prompt.append("\n<SUBTITLE_LINES>\n")
                .append(codec.encode(request.units()))
                .append("\n</SUBTITLE_LINES>");
        return prompt.toString();
    }

    private boolean isModelMissing(Throwable throwable) {
        Throwable cause = throwable;
        while (cause != null) {
            if (cause instanceof ModelNotFoundException) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
