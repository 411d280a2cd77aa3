package com.talentscope.search.retrieval;

public final class SemanticAttempt {
    private final ExecutionOutcome outcome;
    private final String failureReason;

    private SemanticAttempt(ExecutionOutcome outcome, String failureReason) {
        this.outcome = outcome;
        this.failureReason = failureReason;
    }

    public static SemanticAttempt succeeded(ExecutionOutcome outcome) {
        return new SemanticAttempt(outcome, null);
    }

    public static SemanticAttempt failed(String reason) {
        return new SemanticAttempt(null, reason);
    }

    public boolean isSucceeded() {
        return outcome != null;
    }

    public ExecutionOutcome getOutcome() {
        return outcome;
    }

    public String getFailureReason() {
        return failureReason;
    }
}
