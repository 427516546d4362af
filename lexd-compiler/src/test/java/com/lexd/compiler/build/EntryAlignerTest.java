package com.lexd.compiler.build;

import com.lexd.runtime.automaton.Alphabet;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EntryAlignerTest {

    private Alphabet alphabet;

    @BeforeEach
    void setUp() {
        alphabet = new Alphabet();
    }

    private List<String> render(IntList labels) {
        List<String> rendered = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            rendered.add(alphabet.renderLabel(labels.getInt(i)));
        }
        return rendered;
    }

    private List<String> labels(EntryAligner aligner, String left, String right) {
        return render(aligner.labels(alphabet.tokenize(left), alphabet.tokenize(right)));
    }

    @Test
    @DisplayName("Zipping should pad the shorter side with epsilon at the end")
    void testZip() {
        EntryAligner aligner = new EntryAligner(alphabet, false, false);

        assertThat(labels(aligner, "ab", "b")).containsExactly("a:b", "b:0");
        assertThat(labels(aligner, "", "xy")).containsExactly("0:x", "0:y");
        assertThat(labels(aligner, "<n>a", "a")).containsExactly("<n>:a", "a:0");
    }

    @Test
    @DisplayName("Alignment should keep matching symbols together")
    void testAlign() {
        EntryAligner aligner = new EntryAligner(alphabet, true, false);

        assertThat(labels(aligner, "ab", "b")).containsExactly("a:0", "b");
        assertThat(labels(aligner, "cat", "cats")).containsExactly("c", "a", "t", "0:s");
    }

    @Test
    @DisplayName("Without compression a mismatch should become a deletion and an insertion")
    void testAlignWithoutCompression() {
        EntryAligner aligner = new EntryAligner(alphabet, true, false);

        assertThat(labels(aligner, "ab", "cd")).containsExactly("0:c", "0:d", "a:0", "b:0");
    }

    @Test
    @DisplayName("Compression should prefer substitutions and imply alignment")
    void testCompress() {
        EntryAligner aligner = new EntryAligner(alphabet, false, true);

        assertThat(labels(aligner, "ab", "cd")).containsExactly("a:c", "b:d");
        assertThat(labels(aligner, "ab", "b")).containsExactly("a:0", "b");
    }
}
