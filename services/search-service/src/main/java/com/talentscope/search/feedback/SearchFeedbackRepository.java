package com.talentscope.search.feedback;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class SearchFeedbackRepository {
    static final String INSERT_SQL = "INSERT INTO search_feedback "
        + "(user_id, candidate_id, search_query, feedback_type, result_position, relevance_score) "
        + "VALUES (?::uuid, ?::uuid, ?, ?, ?, ?) RETURNING id";

    private final JdbcTemplate jdbcTemplate;

    public SearchFeedbackRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public String insert(String userId, SearchFeedback feedback) {
        Object id = jdbcTemplate.queryForObject(
            INSERT_SQL,
            Object.class,
            userId,
            feedback.candidateId(),
            feedback.searchQuery(),
            feedback.feedbackType().getValue(),
            feedback.resultPosition(),
            feedback.relevanceScore()
        );
        return id == null ? null : id.toString();
    }
}
