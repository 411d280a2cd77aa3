package com.talentscope.search.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class KeywordParser {
    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");
    private static final Pattern SCRIPT_BOUNDARY =
        Pattern.compile("(?<=[가-힣])(?=[a-zA-Z])|(?<=[a-zA-Z.+#])(?=[가-힣])");

    private KeywordParser() {
    }

    /**
     * Splits a free-text query into keywords on whitespace, commas and Hangul/Latin boundaries,
     * so {@code "React개발자"} yields {@code [React, 개발자]}. Digit-Hangul runs such as
     * {@code "5년차"} stay together.
     */
    public static List<String> parse(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        List<String> keywords = new ArrayList<>();
        for (String token : SEPARATORS.split(query.trim())) {
            for (String part : SCRIPT_BOUNDARY.split(token)) {
                String cleaned = QueryEscaper.stripControlCharacters(part).trim();
                if (!cleaned.isEmpty()) {
                    keywords.add(truncate(cleaned, SearchLimits.MAX_KEYWORD_LENGTH));
                }
            }
        }
        return keywords;
    }

    private static String truncate(String value, int maxLength) {
        if (value.length() <= maxLength) {
            return value;
        }
        int end = maxLength;
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end -= 1;
        }
        return value.substring(0, end);
    }
}
