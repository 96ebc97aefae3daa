package ai.subtitle.translator.grouping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextRedistributorTest {

    private final TextRedistributor redistributor = new TextRedistributor();

    @Test
    void splitsProportionallyAtWordBoundaries() {
        assertThat(redistributor.redistribute("aaaa bbbb cccc dddd", List.of(10, 10)))
                .containsExactly("aaaa bbbb", "cccc dddd");
    }

    @Test
    void concatenationReproducesNormalisedTranslation() {
        String translated = "  C'est maintenant une enquête pour homicide du NYPD,\n donc si on coince Hughes, on vous préviendra. ";

        List<String> parts = redistributor.redistribute(translated, List.of(11, 31, 43));

        assertThat(parts).hasSize(3).allSatisfy(part -> assertThat(part).isNotBlank());
        assertThat(String.join(" ", parts)).isEqualTo(translated.strip().replaceAll("\\s+", " "));
    }

    @Test
    void movesSplitsSoEveryEntryGetsAWord() {
        assertThat(redistributor.redistribute("un deux trois", List.of(1, 1, 100)))
                .containsExactly("un", "deux", "trois");
    }

    @Test
    void singleEntryKeepsTheWholeText() {
        assertThat(redistributor.redistribute(" - Oui.\n- Non. ", List.of(20))).containsExactly("- Oui.\n- Non.");
    }

    @Test
    void failsWhenThereAreFewerWordsThanEntries() {
        assertThatThrownBy(() -> redistributor.redistribute("Oui.", List.of(5, 5, 5)))
                .isInstanceOf(RedistributionException.class)
                .hasMessage("Cannot split 1 words across 3 entries");
    }
}
