package com.talentscope.search.common;

import java.util.UUID;

public final class IdGenerator {
    private static final int MAX_HEADER_ID_LENGTH = 128;

    private IdGenerator() {
    }

    public static String resolveRequestId(String headerValue) {
        String accepted = acceptHeader(headerValue);
        return accepted != null ? accepted : "req_" + compactUuid();
    }

    public static String resolveTraceId(String headerValue) {
        String accepted = acceptHeader(headerValue);
        return accepted != null ? accepted : "trace_" + compactUuid();
    }

    private static String acceptHeader(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return null;
        }
        String trimmed = headerValue.trim();
        if (trimmed.length() > MAX_HEADER_ID_LENGTH) {
            return null;
        }
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.')) {
                return null;
            }
        }
        return trimmed;
    }

    private static String compactUuid() {
        return UUID.randomUUID().toString().replace("-", "");
    }
}
