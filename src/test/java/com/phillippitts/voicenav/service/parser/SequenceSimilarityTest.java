package com.phillippitts.voicenav.service.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SequenceSimilarityTest {

    @Test
    void countsMatchingBlocks() {
        // "abcd" vs "bcde": one block "bcd" -> 2*3/8
        assertThat(SequenceSimilarity.ratio("abcd", "bcde")).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void recursesAroundLongestBlock() {
        // blocks "ab" and "de" -> 2*4/10
        assertThat(SequenceSimilarity.ratio("abxde", "abyde")).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void emptyInputs() {
        assertThat(SequenceSimilarity.ratio("", "")).isEqualTo(1.0);
        assertThat(SequenceSimilarity.ratio("abc", "")).isEqualTo(0.0);
    }
}
