package com.talentscope.search.feedback;

public record SearchFeedback(
    String candidateId,
    String searchQuery,
    FeedbackType feedbackType,
    int resultPosition,
    int relevanceScore
) {
}
