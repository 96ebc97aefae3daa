package ai.subtitle.translator.translate;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LanguageNamesTest {

    @Test
    void resolvesCodesToEnglishNames() {
        assertThat(LanguageNames.displayName("en")).isEqualTo("English");
        assertThat(LanguageNames.displayName("hu")).isEqualTo("Hungarian");
        assertThat(LanguageNames.displayName("pt_BR")).isEqualTo("Portuguese");
    }

    @Test
    void keepsUnknownCodes() {
        assertThat(LanguageNames.displayName("xx")).isEqualTo("XX");
        assertThat(LanguageNames.displayName("Klingon")).isEqualTo("Klingon");
        assertThat(LanguageNames.displayName(" ")).isEmpty();
    }
}
