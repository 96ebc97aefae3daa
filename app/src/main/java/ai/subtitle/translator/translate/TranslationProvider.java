package ai.subtitle.translator.translate;

import java.util.List;

/**
 * Translates an ordered list of units. Implementations return one {@link TranslatedUnit} per
 * requested unit, in request order, or throw {@link ProviderException}.
 */
public interface TranslationProvider {

    String name();

    List<TranslatedUnit> translate(TranslationRequest request);
}
