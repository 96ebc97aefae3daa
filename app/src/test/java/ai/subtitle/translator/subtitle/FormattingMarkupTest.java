package ai.subtitle.translator.subtitle;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class FormattingMarkupTest {

    @Test
    void collapsesTagClosedAndReopenedAcrossLines() {
        MarkupExtraction extraction = FormattingMarkup.extract(List.of("<i>Hello there,</i>", "<i>my friend.</i>"), false);

        assertThat(extraction.plainText()).isEqualTo("Hello there, my friend.");
        assertThat(extraction.spans()).extracting(FormattingSpan::tag).containsExactly("<i>", "</i>");
        assertThat(extraction.reinsert("Bonjour mon ami.")).isEqualTo("<i>Bonjour mon ami.</i>");
    }

    @Test
    void snapsInnerTagsToWordBoundaries() {
        MarkupExtraction extraction = FormattingMarkup.extract(List.of("Hello <b>world</b> again"), false);

        assertThat(extraction.plainText()).isEqualTo("Hello world again");
        assertThat(extraction.reinsert("Hello world again")).isEqualTo("Hello <b>world</b> again");
    }

    @Test
    void treatsAssOverrideBlocksAsMarkup() {
        MarkupExtraction extraction = FormattingMarkup.extract(List.of("{\\an8}Top of the screen"), false);

        assertThat(extraction.plainText()).isEqualTo("Top of the screen");
        assertThat(extraction.reinsert("Haut de l'écran")).isEqualTo("{\\an8}Haut de l'écran");
    }

    @Test
    void keepsLineBreaksWhenAsked() {
        MarkupExtraction extraction = FormattingMarkup.extract(List.of("- Have you seen my daughter?", "- No."), true);

        assertThat(extraction.plainText()).isEqualTo("- Have you seen my daughter?\n- No.");
        assertThat(extraction.hasMarkup()).isFalse();
    }

    @Test
    void stripsFontTags() {
        assertThat(FormattingMarkup.strip("<font color=\"#ffff00\">Yellow</font> text")).isEqualTo("Yellow text");
        assertThat(FormattingMarkup.containsMarkup("5 < 6, obviously")).isFalse();
    }

    @Test
    void entryExposesItsFormattingSpans() {
        SubtitleEntry entry = SubtitleEntry.of(1, 0, 1_000, "<i>Whispered</i>");

        assertThat(entry.formattingSpans())
                .containsExactly(new FormattingSpan("<i>", 0.0), new FormattingSpan("</i>", 1.0));
    }
}
