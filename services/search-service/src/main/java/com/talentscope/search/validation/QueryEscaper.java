package com.talentscope.search.validation;

import java.util.regex.Pattern;

/**
 * Escaping for values that end up inside SQL predicates. Values are always bound as statement
 * parameters as well; escaping keeps wildcard and array-literal metacharacters from changing
 * what a predicate matches.
 */
public final class QueryEscaper {
    private static final Pattern DANGEROUS_CHARACTERS =
        Pattern.compile("[\\u0000-\\u001F\\u007F\\u200B-\\u200D\\uFEFF]");
    private static final Pattern ARRAY_METACHARACTERS = Pattern.compile("[{}\\[\\]\",\\\\]");

    private QueryEscaper() {
    }

    /**
     * Removes control characters and zero-width code points. Returns {@code null} for {@code null}.
     */
    public static String stripControlCharacters(String value) {
        if (value == null) {
            return null;
        }
        return DANGEROUS_CHARACTERS.matcher(value).replaceAll("");
    }

    /**
     * Escapes {@code \}, {@code %} and {@code _} so the value matches literally inside a
     * LIKE/ILIKE pattern using the default backslash escape.
     */
    public static String escapeLikePattern(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' || c == '%' || c == '_') {
                builder.append('\\');
            }
            builder.append(c);
        }
        return builder.toString();
    }

    public static String containsPattern(String value) {
        return "%" + escapeLikePattern(value) + "%";
    }

    /**
     * Strips characters that carry meaning inside a Postgres array literal.
     */
    public static String sanitizeArrayValue(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = stripControlCharacters(value);
        return ARRAY_METACHARACTERS.matcher(cleaned).replaceAll("").trim();
    }
}
