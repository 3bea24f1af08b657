package com.docprinter.printer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StringWidthTest {

    @Test
    void countsAsciiByLength() {
        assertThat(StringWidth.of("", 4)).isZero();
        assertThat(StringWidth.of("hello, world", 4)).isEqualTo(12);
    }

    @Test
    void countsWideCharactersAsTwoColumns() {
        assertThat(StringWidth.of("日本語", 4)).isEqualTo(6);
        assertThat(StringWidth.of("a한b", 4)).isEqualTo(4);
    }

    @Test
    void countsSupplementaryCharactersOnce() {
        assertThat(StringWidth.of("😀", 4)).isEqualTo(2);
        assertThat(StringWidth.of("𝐀", 4)).isEqualTo(1);
    }

    @Test
    void countsTabsAsTabWidth() {
        assertThat(StringWidth.of("\tx", 4)).isEqualTo(5);
        assertThat(StringWidth.of("a\t\t", 2)).isEqualTo(5);
        assertThat(StringWidth.of("\t日", 8)).isEqualTo(10);
    }

    @Test
    void measuresPartOfABuffer() {
        StringBuilder output = new StringBuilder("first\n\tsecond");

        assertThat(StringWidth.of(output.subSequence(6, output.length()), 3)).isEqualTo(9);
    }
}
