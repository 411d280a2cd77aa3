package com.talentscope.search.validation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class KeywordParserTest {

    @Test
    void splitsHangulLatinBoundaries() {
        assertThat(KeywordParser.parse("React개발자")).containsExactly("React", "개발자");
        assertThat(KeywordParser.parse("백엔드Java")).containsExactly("백엔드", "Java");
        assertThat(KeywordParser.parse("C#개발자")).containsExactly("C#", "개발자");
    }

    @Test
    void keepsDigitHangulRunsTogether() {
        assertThat(KeywordParser.parse("5년차 프론트엔드")).containsExactly("5년차", "프론트엔드");
    }

    @Test
    void splitsOnWhitespaceAndCommas() {
        assertThat(KeywordParser.parse(" Java,  Spring ,,Kotlin ")).containsExactly("Java", "Spring", "Kotlin");
        assertThat(KeywordParser.parse("   ")).isEmpty();
        assertThat(KeywordParser.parse(null)).isEmpty();
    }

    @Test
    void truncatesLongKeywords() {
        assertThat(KeywordParser.parse("x".repeat(80))).containsExactly("x".repeat(50));
    }
}
