package ai.subtitle.translator.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Mock provider that marks each unit instead of translating it.
 */
public class MockTranslationProvider implements TranslationProvider {

    @Override
    public String name() {
        return "mock";
    }

    @Override
    public List<TranslatedUnit> translate(TranslationRequest request) {
        List<TranslatedUnit> result = new ArrayList<>(request.units().size());
        for (TranslationUnit unit : request.units()) {
            result.add(new TranslatedUnit(unit.unitId(), "[MOCK] " + unit.text()));
        }
        return result;
    }
}
