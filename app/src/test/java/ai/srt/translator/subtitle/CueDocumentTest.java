package ai.srt.translator.subtitle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class CueDocumentTest {

    private static final Timestamp ONE = new Timestamp(0, 0, 1, 0);
    private static final Timestamp TWO = new Timestamp(0, 0, 2, 0);

    @Test
    void countsCodePointsRatherThanBytes() {
        CueDocument document = new CueDocument(List.of(
                new Cue(1, ONE, TWO, "こんにちは"),
                new Cue(2, ONE, TWO, "😀!")));

        assertThat(document.totalChars()).isEqualTo(7);
    }

    @Test
    void renumbersCuesByPosition() {
        CueDocument document = new CueDocument(List.of(
                new Cue(7, ONE, TWO, "a"),
                new Cue(3, ONE, TWO, "b")));

        assertThat(document.cues()).extracting(Cue::index).containsExactly(1, 2);
    }

    @Test
    void rejectsCueThatEndsBeforeItStarts() {
        assertThatThrownBy(() -> new CueDocument(List.of(new Cue(1, TWO, ONE, "backwards"))))
                .isInstanceOf(InvalidTimestampException.class)
                .hasMessageContaining("before it starts");
    }

    @Test
    void replaceTextsKeepsTiming() {
        CueDocument document = new CueDocument(List.of(new Cue(1, ONE, TWO, "Hello")));

        document.replaceTexts(List.of("Bonjour"));

        assertThat(document.get(0)).isEqualTo(new Cue(1, ONE, TWO, "Bonjour"));
    }

    @Test
    void replaceTextsDropsBlankLinesAndCarriageReturns() {
        CueDocument document = new CueDocument(List.of(new Cue(1, ONE, TWO, "Hello")));

        document.replaceTexts(List.of("Bonjour\r\n\n  \r\nle monde\n"));

        assertThat(document.get(0).text()).isEqualTo("Bonjour\nle monde");
        assertThat(document.totalChars()).isEqualTo(16);
    }

    @Test
    void replaceTextsRejectsCountMismatch() {
        CueDocument document = new CueDocument(List.of(new Cue(1, ONE, TWO, "Hello")));

        assertThatThrownBy(() -> document.replaceTexts(List.of("a", "b")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(document.get(0).text()).isEqualTo("Hello");
    }

    @Test
    void copyIsDetached() {
        CueDocument document = new CueDocument(List.of(new Cue(1, ONE, TWO, "Hello")));
        CueDocument copy = document.copy();

        copy.replaceTexts(List.of("changed"));

        assertThat(document.get(0).text()).isEqualTo("Hello");
        assertThat(CueDocument.empty().isEmpty()).isTrue();
    }
}
