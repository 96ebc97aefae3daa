package ai.subtitle.translator.engine;

import ai.subtitle.translator.grouping.CrossEntryGroup;
import ai.subtitle.translator.translate.ProviderException;
import ai.subtitle.translator.translate.TranslatedUnit;
import ai.subtitle.translator.translate.TranslationRequest;
import ai.subtitle.translator.translate.TranslationRequest.PriorTranslation;
import ai.subtitle.translator.translate.TranslationUnit;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One provider call per unit, with the neighbouring source lines as context and the previous
 * translation as a consistency hint.
 */
class LineByLineExecutor implements ModeExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineByLineExecutor.class);

    private final ExecutionSettings settings;
    private final ProviderCaller caller;
    private final UnitContextBuilder contextBuilder;

    LineByLineExecutor(ExecutionSettings settings, ProviderCaller caller) {
        this.settings = settings;
        this.caller = caller;
        this.contextBuilder = new UnitContextBuilder(settings.contextWindow());
    }

    @Override
    public void execute(EngineRun run) {
        List<CrossEntryGroup> units = run.units();
        for (int position = 0; position < units.size(); position++) {
            CrossEntryGroup unit = units.get(position);
            if (run.isDone(unit)) {
                continue;
            }
            if (run.stopRequested()) {
                LOGGER.info("Stop requested; leaving units from {} untranslated", unit.unitId());
                return;
            }
            TranslationUnit request = new TranslationUnit(unit.unitId(), unit.sourceText(),
                    contextBuilder.contextFor(units, position));
            try {
                List<TranslatedUnit> result = caller.call(new TranslationRequest(settings.sourceLanguage(),
                        settings.targetLanguage(), List.of(request), priorTranslation(run, position)));
                run.record(result);
            } catch (ProviderException ex) {
                LOGGER.error("Unit {} (entries {}) failed on every provider: {}", unit.unitId(), unit.entryIndices(), ex.getMessage());
                run.fail(List.of(unit.unitId()));
            }
        }
    }

    private List<PriorTranslation> priorTranslation(EngineRun run, int position) {
        if (position == 0) {
            return List.of();
        }
        CrossEntryGroup previous = run.unit(position - 1);
        String translation = run.translationOf(previous.unitId());
        if (translation == null) {
            return List.of();
        }
        return List.of(new PriorTranslation(previous.sourceText(), translation));
    }
}
