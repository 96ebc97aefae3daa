package ai.subtitle.translator.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider used for dry-run scenarios that returns the source text without invoking remote APIs.
 */
public class PassThroughTranslationProvider implements TranslationProvider {

    @Override
    public String name() {
        return "dry-run";
    }

    @Override
    public List<TranslatedUnit> translate(TranslationRequest request) {
        List<TranslatedUnit> result = new ArrayList<>(request.units().size());
        for (TranslationUnit unit : request.units()) {
            result.add(new TranslatedUnit(unit.unitId(), unit.text()));
        }
        return result;
    }
}
