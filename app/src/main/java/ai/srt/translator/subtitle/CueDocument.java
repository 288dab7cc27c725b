package ai.srt.translator.subtitle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered sequence of cues in playback order. Only cue texts can change after construction.
 */
public final class CueDocument {

    private final List<Cue> cues;

    public CueDocument(List<Cue> cues) {
        Objects.requireNonNull(cues, "cues");
        List<Cue> numbered = new ArrayList<>(cues.size());
        for (int i = 0; i < cues.size(); i++) {
            numbered.add(Objects.requireNonNull(cues.get(i), "cue").withIndex(i + 1).validate());
        }
        this.cues = numbered;
    }

    public static CueDocument empty() {
        return new CueDocument(List.of());
    }

    public List<Cue> cues() {
        return Collections.unmodifiableList(cues);
    }

    public int size() {
        return cues.size();
    }

    public boolean isEmpty() {
        return cues.isEmpty();
    }

    public Cue get(int position) {
        return cues.get(position);
    }

    public List<String> texts() {
        return cues.stream().map(Cue::text).collect(Collectors.toList());
    }

    /**
     * Sum of code points across every cue text.
     */
    public long totalChars() {
        long total = 0;
        for (Cue cue : cues) {
            total += cue.charCount();
        }
        return total;
    }

    /**
     * Replaces every cue text by position. Timing and indices are left untouched.
     *
     * @throws IllegalArgumentException when the number of texts differs from the cue count
     */
    public void replaceTexts(List<String> texts) {
        Objects.requireNonNull(texts, "texts");
        if (texts.size() != cues.size()) {
            throw new IllegalArgumentException("Expected " + cues.size() + " texts but got " + texts.size());
        }
        for (int i = 0; i < cues.size(); i++) {
            cues.set(i, cues.get(i).withText(texts.get(i)));
        }
    }

    public CueDocument copy() {
        return new CueDocument(cues);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CueDocument document)) {
            return false;
        }
        return cues.equals(document.cues);
    }

    @Override
    public int hashCode() {
        return cues.hashCode();
    }

    @Override
    public String toString() {
        return "CueDocument[cues=" + cues.size() + "]";
    }
}
