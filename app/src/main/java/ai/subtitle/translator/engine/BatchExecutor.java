package ai.subtitle.translator.engine;

import ai.subtitle.translator.grouping.CrossEntryGroup;
import ai.subtitle.translator.translate.ProviderException;
import ai.subtitle.translator.translate.TranslatedUnit;
import ai.subtitle.translator.translate.TranslationRequest;
import ai.subtitle.translator.translate.TranslationRequest.PriorTranslation;
import ai.subtitle.translator.translate.TranslationUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size batches of pending units, each preceded by up to {@code overlapSize} already
 * translated units. With reassessment the overlap units are translated again and a differing
 * answer replaces the stored one; without it they travel as prior translations only.
 */
class BatchExecutor implements ModeExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchExecutor.class);

    private final ExecutionSettings settings;
    private final ProviderCaller caller;
    private final UnitContextBuilder contextBuilder;

    BatchExecutor(ExecutionSettings settings, ProviderCaller caller) {
        this.settings = settings;
        this.caller = caller;
        this.contextBuilder = new UnitContextBuilder(settings.contextWindow());
    }

    @Override
    public void execute(EngineRun run) {
        List<Integer> pending = run.pendingPositions();
        for (int start = 0; start < pending.size(); start += settings.batchSize()) {
            List<Integer> batch = pending.subList(start, Math.min(pending.size(), start + settings.batchSize()));
            if (run.stopRequested()) {
                LOGGER.info("Stop requested; leaving {} units untranslated", pending.size() - start);
                return;
            }
            translateBatch(run, batch);
        }
    }

    private void translateBatch(EngineRun run, List<Integer> batch) {
        List<CrossEntryGroup> units = run.units();
        List<CrossEntryGroup> overlap = overlapBefore(run, batch.get(0));
        List<TranslationUnit> requestUnits = new ArrayList<>();
        List<PriorTranslation> priors = new ArrayList<>();
        if (settings.overlapReassessment()) {
            overlap.forEach(unit -> requestUnits.add(new TranslationUnit(unit.unitId(), unit.sourceText())));
        } else {
            overlap.forEach(unit -> priors.add(new PriorTranslation(unit.sourceText(), run.translationOf(unit.unitId()))));
        }
        int first = batch.get(0);
        int last = batch.get(batch.size() - 1);
        for (int position : batch) {
            String context = position == first ? contextBuilder.contextForRange(units, first, last + 1) : "";
            CrossEntryGroup unit = units.get(position);
            requestUnits.add(new TranslationUnit(unit.unitId(), unit.sourceText(), context));
        }

        Set<Integer> batchIds = batch.stream().map(position -> units.get(position).unitId()).collect(Collectors.toSet());
        TranslationRequest request = new TranslationRequest(settings.sourceLanguage(), settings.targetLanguage(), requestUnits, priors);
        List<TranslatedUnit> result;
        try {
            result = caller.call(request);
        } catch (ProviderException ex) {
            List<Integer> failed = batchIds.stream().sorted().collect(Collectors.toList());
            LOGGER.error("Units {} failed on every provider: {}", failed, ex.getMessage());
            run.fail(failed);
            return;
        }

        Map<Integer, String> accepted = new LinkedHashMap<>();
        for (TranslatedUnit translated : result) {
            String text = translated.text().strip();
            if (batchIds.contains(translated.unitId())) {
                accepted.put(translated.unitId(), text);
            } else if (!text.equals(run.translationOf(translated.unitId()))) {
                LOGGER.info("Overlap reassessment replaced translation of unit {}", translated.unitId());
                accepted.put(translated.unitId(), text);
            }
        }
        run.record(accepted);
    }

    private List<CrossEntryGroup> overlapBefore(EngineRun run, int position) {
        List<CrossEntryGroup> overlap = new ArrayList<>();
        for (int i = position - 1; i >= 0 && overlap.size() < settings.overlapSize(); i--) {
            CrossEntryGroup candidate = run.unit(i);
            if (run.isDone(candidate)) {
                overlap.add(0, candidate);
            } else {
                break;
            }
        }
        return overlap;
    }
}
