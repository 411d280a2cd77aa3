package com.talentscope.search.store;

public class CandidateStoreException extends RuntimeException {
    public CandidateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
