package ai.subtitle.translator.engine;

import ai.subtitle.translator.translate.ProviderException;
import ai.subtitle.translator.translate.TranslatedUnit;
import ai.subtitle.translator.translate.TranslationRequest;
import ai.subtitle.translator.translate.TranslationUnit;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All pending units in a single provider call. Files above the unit ceiling are handed to the
 * batch executor instead.
 */
class WholeFileExecutor implements ModeExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(WholeFileExecutor.class);

    private final ExecutionSettings settings;
    private final ProviderCaller caller;
    private final ModeExecutor overflow;

    WholeFileExecutor(ExecutionSettings settings, ProviderCaller caller) {
        this(settings, caller, new BatchExecutor(settings, caller));
    }

    WholeFileExecutor(ExecutionSettings settings, ProviderCaller caller, ModeExecutor overflow) {
        this.settings = settings;
        this.caller = caller;
        this.overflow = overflow;
    }

    @Override
    public void execute(EngineRun run) {
        List<Integer> pending = run.pendingPositions();
        if (pending.isEmpty()) {
            return;
        }
        if (run.units().size() > settings.wholeFileMaxUnits()) {
            LOGGER.warn("{} units exceed the whole-file limit of {}; falling back to batch mode",
                    run.units().size(), settings.wholeFileMaxUnits());
            overflow.execute(run);
            return;
        }
        if (run.stopRequested()) {
            LOGGER.info("Stop requested before the whole-file call");
            return;
        }
        List<TranslationUnit> units = pending.stream()
                .map(run::unit)
                .map(unit -> new TranslationUnit(unit.unitId(), unit.sourceText()))
                .collect(Collectors.toList());
        try {
            List<TranslatedUnit> result = caller.call(new TranslationRequest(settings.sourceLanguage(),
                    settings.targetLanguage(), units));
            run.record(result);
        } catch (ProviderException ex) {
            List<Integer> failed = units.stream().map(TranslationUnit::unitId).collect(Collectors.toList());
            LOGGER.error("Whole-file call for {} units failed on every provider: {}", failed.size(), ex.getMessage());
            run.fail(failed);
        }
    }
}
