package com.talentscope.search.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class QueryEscaperTest {
    private static final List<String> ADVERSARIAL = List.of(
        "C_",
        "100%",
        "a\\b",
        "%' OR '1'='1",
        "_%_",
        "\\%",
        "'; DROP TABLE candidates; --",
        "{React,\"Vue\"}",
        "[1,2]"
    );

    @Test
    void escapesLikeMetacharacters() {
        assertEquals("C\\_", QueryEscaper.escapeLikePattern("C_"));
        assertEquals("100\\%", QueryEscaper.escapeLikePattern("100%"));
        assertEquals("a\\\\b", QueryEscaper.escapeLikePattern("a\\b"));
        assertEquals("%C++%", QueryEscaper.containsPattern("C++"));
        assertEquals("", QueryEscaper.escapeLikePattern(null));
    }

    @Test
    void escapedPatternsMatchOnlyLiterally() {
        for (String value : ADVERSARIAL) {
            Pattern like = likeToRegex(QueryEscaper.escapeLikePattern(value));
            assertThat(like.matcher(value).matches()).as(value).isTrue();
        }
        Pattern underscore = likeToRegex(QueryEscaper.escapeLikePattern("C_"));
        assertThat(underscore.matcher("C#").matches()).isFalse();
        Pattern percent = likeToRegex(QueryEscaper.escapeLikePattern("100%"));
        assertThat(percent.matcher("1000 users").matches()).isFalse();
    }

    @Test
    void sanitizesArrayLiteralCharacters() {
        assertEquals("ReactVue", QueryEscaper.sanitizeArrayValue("{React,\"Vue\"}"));
        assertEquals("12", QueryEscaper.sanitizeArrayValue("[1,2]"));
        assertEquals("Node.js", QueryEscaper.sanitizeArrayValue(" Node.js\u0000 "));
        assertEquals("ab", QueryEscaper.sanitizeArrayValue("a\\b"));
        assertEquals("", QueryEscaper.sanitizeArrayValue(null));
        for (String value : ADVERSARIAL) {
            assertThat(QueryEscaper.sanitizeArrayValue(value)).doesNotContain("{", "}", "[", "]", "\"", ",", "\\");
        }
    }

    @Test
    void stripsControlCharacters() {
        assertEquals("ab", QueryEscaper.stripControlCharacters("a\u0007\u200Cb\uFEFF"));
        assertEquals(null, QueryEscaper.stripControlCharacters(null));
    }

    /**
     * Translates a LIKE pattern with backslash escapes into an equivalent regex.
     */
    private static Pattern likeToRegex(String like) {
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < like.length(); i++) {
            char c = like.charAt(i);
            if (c == '\\' && i + 1 < like.length()) {
                regex.append(Pattern.quote(String.valueOf(like.charAt(++i))));
            } else if (c == '%') {
                regex.append(".*");
            } else if (c == '_') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
