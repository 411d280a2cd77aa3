package com.talentscope.search.execution;

public class SearchTimeoutException extends RuntimeException {
    public SearchTimeoutException(String stage) {
        super("search deadline exceeded stage=" + stage);
    }
}
