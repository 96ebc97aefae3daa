package ai.subtitle.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class NumberedUnitCodecTest {

    private final NumberedUnitCodec codec = new NumberedUnitCodec();

    @Test
    void encodesOneNumberedLinePerUnit() {
        String encoded = codec.encode(List.of(
                new TranslationUnit(0, "This is now an NYPD homicide investigation."),
                new TranslationUnit(3, "- Have you seen my daughter?\n- No.")));

        assertThat(encoded).isEqualTo("""
                [0] This is now an NYPD homicide investigation.
                [3] - Have you seen my daughter? <br> - No.""");
    }

    @Test
    void decodesNumberedLinesAndRestoresLineBreaks() {
        List<TranslatedUnit> decoded = codec.decode("""
                Here is the translation:
                ```
                [0] C'est désormais une enquête criminelle.
                [3] - Tu as vu ma fille ?<br>- Non.
                ```
                """);

        assertThat(decoded).containsExactly(
                new TranslatedUnit(0, "C'est désormais une enquête criminelle."),
                new TranslatedUnit(3, "- Tu as vu ma fille ?\n- Non."));
    }

    @Test
    void joinsWrappedContinuationLines() {
        List<TranslatedUnit> decoded = codec.decode("[1] \"Une phrase qui\ncontinue ici.\"\n[2] Fin.");

        assertThat(decoded).extracting(TranslatedUnit::text)
                .containsExactly("Une phrase qui continue ici.", "Fin.");
    }

    @Test
    void rejectsUnusableReplies() {
        assertThatThrownBy(() -> codec.decode("  \n")).isInstanceOf(ProviderException.class)
                .hasMessage("Empty response from provider");
        assertThatThrownBy(() -> codec.decode("Bonjour tout le monde")).isInstanceOf(ProviderException.class)
                .hasMessage("Response contains no numbered lines");
        assertThatThrownBy(() -> codec.decode("[1] Un\n[1] Deux")).isInstanceOf(ProviderException.class)
                .hasMessage("Response repeats unit 1");
    }
}
