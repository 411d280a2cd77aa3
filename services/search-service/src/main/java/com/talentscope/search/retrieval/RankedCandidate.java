package com.talentscope.search.retrieval;

import com.talentscope.search.store.CandidateRow;

/**
 * A candidate row with its retrieval score in {@code [0, 1]}.
 */
public record RankedCandidate(CandidateRow row, double score) {
}
