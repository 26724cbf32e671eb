package com.kbengine.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SnippetsTest {

    @Test
    @DisplayName("Whitespace is collapsed and short content is returned whole")
    void shortContent() {
        assertThat(Snippets.of("  one\n\ntwo\tthree ", 50)).isEqualTo("one two three");
        assertThat(Snippets.of(null, 50)).isEmpty();
    }

    @Test
    @DisplayName("Long content is cut at a word boundary")
    void cutsAtWord() {
        assertThat(Snippets.of("alpha beta gamma delta", 13)).isEqualTo("alpha beta...");
    }

    @Test
    @DisplayName("A single long word is cut at the limit")
    void cutsLongWord() {
        assertThat(Snippets.of("abcdefghijklmnopqrstuvwxyz", 10)).isEqualTo("abcdefghij...");
    }
}
