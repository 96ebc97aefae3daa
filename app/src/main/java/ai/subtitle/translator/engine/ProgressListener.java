package ai.subtitle.translator.engine;

import java.util.Map;

/**
 * Receives translations as soon as a provider call succeeds, keyed by unit id. Replaced overlap
 * translations are reported again with their new text.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = translations -> { };

    void onUnitsTranslated(Map<Integer, String> translations);
}
