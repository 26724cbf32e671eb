package com.kbengine.chunking;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SectionAnchorsTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Attributes|attributes",
        "Attributes & Relations|attributes--relations",
        "Estados (Ciclo de vida)|estados-ciclo-de-vida",
        "Descripción|descripción",
        "snake_case-name|snake_case-name",
        "  Padded  |padded"
    })
    void slugifiesHeadings(String heading, String expected) {
        assertThat(SectionAnchors.slugify(heading)).isEqualTo(expected);
    }

    @Test
    void usesDeepestHeading() {
        assertThat(SectionAnchors.fromHeadingPath(List.of("User", "Attributes"))).isEqualTo("attributes");
        assertThat(SectionAnchors.fromHeadingPath(List.of())).isNull();
        assertThat(SectionAnchors.fromHeadingPath(null)).isNull();
        assertThat(SectionAnchors.fromHeadingPath(List.of("!!!"))).isNull();
    }
}
