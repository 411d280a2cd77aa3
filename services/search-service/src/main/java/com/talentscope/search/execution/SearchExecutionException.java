package com.talentscope.search.execution;

public class SearchExecutionException extends RuntimeException {
    public SearchExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
