package ai.subtitle.translator.grouping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class GroupingRulesTest {

    private final GroupingRules rules = GroupingRules.defaults();

    @Test
    void recognisesTerminalPunctuation() {
        assertThat(rules.completesSentence("Stop right there.")).isTrue();
        assertThat(rules.completesSentence("Really?")).isTrue();
        assertThat(rules.completesSentence("Watch out!")).isTrue();
        assertThat(rules.completesSentence("And then…")).isTrue();
        assertThat(rules.completesSentence("investigation,")).isFalse();
        assertThat(rules.completesSentence("This is now")).isFalse();
    }

    @Test
    void looksPastClosingQuotesAndMarkup() {
        assertThat(rules.completesSentence("He said \"stop.\"")).isTrue();
        assertThat(rules.completesSentence("(quietly.)")).isTrue();
        assertThat(rules.completesSentence("<i>Really?</i>")).isTrue();
        assertThat(rules.completesSentence("<i>Wait</i>")).isFalse();
    }

    @Test
    void detectsSpeakerTurns() {
        assertThat(rules.startsSpeakerTurn("- No.")).isTrue();
        assertThat(rules.startsSpeakerTurn("– Yes.")).isTrue();
        assertThat(rules.startsSpeakerTurn("<i>— Maybe.</i>")).isTrue();
        assertThat(rules.startsSpeakerTurn("Well-known facts")).isFalse();
    }

    @Test
    void usesConfiguredMarkers() {
        GroupingRules custom = rules.withDialogueMarkers(List.of(">>"));

        assertThat(custom.startsSpeakerTurn(">> Over here")).isTrue();
        assertThat(custom.startsSpeakerTurn("- Over here")).isFalse();
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> rules.withMaxGroupSize(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rules.withContinuityGapMillis(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> rules.withDialogueMarkers(List.of(" "))).isInstanceOf(IllegalArgumentException.class);
    }
}
