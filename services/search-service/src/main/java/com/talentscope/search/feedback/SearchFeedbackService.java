package com.talentscope.search.feedback;

import com.talentscope.search.api.dto.SearchFeedbackRequest;
import com.talentscope.search.security.CallerIdentity;
import com.talentscope.search.validation.InvalidSearchRequestException;
import com.talentscope.search.validation.QueryEscaper;
import com.talentscope.search.validation.SearchLimits;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Records relevance feedback on a search result for later ranking analysis.
 */
@Service
public class SearchFeedbackService {
    private static final Logger logger = LoggerFactory.getLogger(SearchFeedbackService.class);

    static final int MAX_RESULT_POSITION = 1000;
    static final int MAX_RELEVANCE_SCORE = 100;

    private final SearchFeedbackRepository repository;

    public SearchFeedbackService(SearchFeedbackRepository repository) {
        this.repository = repository;
    }

    public String submit(CallerIdentity caller, SearchFeedbackRequest request) {
        SearchFeedback feedback = validate(request);
        String id = repository.insert(caller.userId(), feedback);
        logger.info(
            "search_feedback_recorded id={} type={} position={}",
            id,
            feedback.feedbackType().getValue(),
            feedback.resultPosition()
        );
        return id;
    }

    static SearchFeedback validate(SearchFeedbackRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        String candidateId = request.getCandidateId() == null ? null : request.getCandidateId().trim();
        if (candidateId == null || !isUuid(candidateId)) {
            throw new InvalidSearchRequestException("candidateId must be a valid UUID");
        }
        String searchQuery = QueryEscaper.stripControlCharacters(request.getSearchQuery());
        searchQuery = searchQuery == null ? "" : searchQuery.trim();
        if (searchQuery.isEmpty()) {
            throw new InvalidSearchRequestException("searchQuery is required");
        }
        if (searchQuery.length() > SearchLimits.MAX_QUERY_LENGTH) {
            throw new InvalidSearchRequestException(
                "searchQuery must be at most " + SearchLimits.MAX_QUERY_LENGTH + " characters"
            );
        }
        FeedbackType type = FeedbackType.fromValue(request.getFeedbackType());
        if (type == null) {
            throw new InvalidSearchRequestException(
                "feedbackType must be one of relevant, not_relevant, clicked, contacted"
            );
        }
        int position = boundedOrDefault(request.getResultPosition(), MAX_RESULT_POSITION, "resultPosition");
        int relevance = boundedOrDefault(request.getRelevanceScore(), MAX_RELEVANCE_SCORE, "relevanceScore");
        return new SearchFeedback(candidateId, searchQuery, type, position, relevance);
    }

    private static int boundedOrDefault(Integer value, int max, String field) {
        if (value == null) {
            return 0;
        }
        if (value < 0 || value > max) {
            throw new InvalidSearchRequestException(field + " must be between 0 and " + max);
        }
        return value;
    }

    private static boolean isUuid(String value) {
        try {
            UUID.fromString(value);
            return value.length() == 36;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
