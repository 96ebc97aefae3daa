package ai.subtitle.translator.subtitle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RowReflowTest {

    @Test
    void leavesShortTextOnOneRow() {
        assertThat(new RowReflow(42, SplitMethod.EVEN).reflow("Short line.")).containsExactly("Short line.");
    }

    @Test
    void disabledReflowKeepsOnlyHardBreaks() {
        assertThat(RowReflow.disabled().reflow("A very long translated sentence that nobody wraps\nSecond"))
                .containsExactly("A very long translated sentence that nobody wraps", "Second");
    }

    @Test
    void evenSplitMinimisesLengthDifference() {
        assertThat(RowReflow.evenBreakIndex("Bonjour tout le monde")).isEqualTo(12);
        assertThat(new RowReflow(16, SplitMethod.EVEN).reflow("Bonjour tout le monde"))
                .containsExactly("Bonjour tout", "le monde");
    }

    @Test
    void evenSplitBreaksTiesTowardsMidpoint() {
        assertThat(RowReflow.evenBreakIndex("ab cd ef")).isEqualTo(5);
    }

    @Test
    void evenSplitRecursesIntoHalvesThatStillOverflow() {
        assertThat(new RowReflow(8, SplitMethod.EVEN).reflow("one two three four five six"))
                .allSatisfy(row -> assertThat(row.length()).isLessThanOrEqualTo(8))
                .containsExactly("one two", "three", "four", "five six");
    }

    @Test
    void evenSplitFallsBackToCharactersWithoutWhitespace() {
        assertThat(RowReflow.evenBreakIndex("abcdefghij")).isEqualTo(-1);
        assertThat(new RowReflow(4, SplitMethod.EVEN).reflow("abcdefghij")).containsExactly("abcd", "efgh", "ij");
    }

    @Test
    void wordSplitFillsGreedily() {
        assertThat(new RowReflow(16, SplitMethod.WORD).reflow("Bonjour tout le monde"))
                .containsExactly("Bonjour tout le", "monde");
    }

    @Test
    void wordSplitKeepsOverlongWordOnItsOwnRow() {
        assertThat(new RowReflow(10, SplitMethod.WORD).reflow("Supercalifragilistic is long"))
                .containsExactly("Supercalifragilistic", "is long");
    }

    @Test
    void charSplitCutsAtTheExactLimit() {
        assertThat(new RowReflow(10, SplitMethod.CHAR).reflow("Bonjour tout le monde"))
                .containsExactly("Bonjour to", "ut le mond", "e");
    }

    @Test
    void reflowsEachDialogueLineSeparately() {
        assertThat(new RowReflow(12, SplitMethod.WORD).reflow("- Où est ma fille ?\n- Non."))
                .containsExactly("- Où est ma", "fille ?", "- Non.");
    }

    @Test
    void rejectsNegativeLimit() {
        assertThatThrownBy(() -> new RowReflow(-1, SplitMethod.WORD))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parsesSplitMethodNames() {
        assertThat(SplitMethod.from("Word")).isEqualTo(SplitMethod.WORD);
        assertThat(SplitMethod.from(" ")).isEqualTo(SplitMethod.EVEN);
        assertThatThrownBy(() -> SplitMethod.from("syllable")).isInstanceOf(IllegalArgumentException.class);
    }
}
