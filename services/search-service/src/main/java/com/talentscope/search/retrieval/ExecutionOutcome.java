package com.talentscope.search.retrieval;

import java.util.List;

public class ExecutionOutcome {
    private final SearchPath path;
    private final List<RankedCandidate> candidates;
    private final long total;

    public ExecutionOutcome(SearchPath path, List<RankedCandidate> candidates, long total) {
        this.path = path;
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
        this.total = Math.max(total, this.candidates.size());
    }

    public SearchPath getPath() {
        return path;
    }

    public List<RankedCandidate> getCandidates() {
        return candidates;
    }

    public long getTotal() {
        return total;
    }

    public String getSearchMode() {
        return path.getSearchMode();
    }
}
