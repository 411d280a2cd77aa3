package com.talentscope.search.feedback;

import java.util.Locale;

public enum FeedbackType {
    RELEVANT("relevant"),
    NOT_RELEVANT("not_relevant"),
    CLICKED("clicked"),
    CONTACTED("contacted");

    private final String value;

    FeedbackType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static FeedbackType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (FeedbackType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
