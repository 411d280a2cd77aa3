package com.talentscope.search.store;

import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.execution.SearchDeadline;
import com.talentscope.search.validation.CandidateFilters;
import java.util.List;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Candidate reads for every search path. Each statement is bounded by the caller's
 * {@link SearchDeadline}: an expired deadline fails before the statement is sent, otherwise the
 * remaining budget becomes the statement's query timeout.
 */
@Repository
public class CandidateSearchRepository {
    private final JdbcTemplate jdbcTemplate;
    private final CandidateRowMapper rowMapper;

    public CandidateSearchRepository(JdbcTemplate jdbcTemplate, SearchProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.rowMapper = new CandidateRowMapper(properties.getMaxSkillsPerCandidate());
    }

    public List<CandidateRow> findByKeywords(CandidateFilterQuery query, SearchDeadline deadline) {
        return queryRows("keyword_search", CandidateSqlBuilder.keywordSearch(query), deadline);
    }

    public long countByKeywords(CandidateFilterQuery query, SearchDeadline deadline) {
        return count("keyword_count", CandidateSqlBuilder.keywordCount(query), deadline);
    }

    public List<CandidateRow> findBySkillGroup(
        String userId,
        List<String> groupTerms,
        CandidateFilters filters,
        int limit,
        SearchDeadline deadline
    ) {
        return queryRows(
            "skill_group_search",
            CandidateSqlBuilder.skillGroupSearch(userId, groupTerms, filters, limit),
            deadline
        );
    }

    public List<CandidateRow> findByFallback(
        String userId,
        String queryText,
        CandidateFilters filters,
        int limit,
        int offset,
        SearchDeadline deadline
    ) {
        return queryRows(
            "fallback_search",
            CandidateSqlBuilder.fallbackSearch(userId, queryText, filters, limit, offset),
            deadline
        );
    }

    public long countByFallback(String userId, String queryText, CandidateFilters filters, SearchDeadline deadline) {
        return count("fallback_count", CandidateSqlBuilder.fallbackCount(userId, queryText, filters), deadline);
    }

    public List<CandidateRow> searchBySkillsJoin(SkillJoinQuery query, SearchDeadline deadline) {
        return queryRows("skill_join_search", CandidateSqlBuilder.skillJoinSearch(query), deadline);
    }

    public List<CandidateRow> searchByVector(SingleGroupVectorQuery query, SearchDeadline deadline) {
        return queryRows("vector_search", CandidateSqlBuilder.vectorSearch(query), deadline);
    }

    public List<CandidateRow> searchByVectorParallel(ParallelGroupVectorQuery query, SearchDeadline deadline) {
        return queryRows("vector_search_parallel", CandidateSqlBuilder.parallelVectorSearch(query), deadline);
    }

    private List<CandidateRow> queryRows(String operation, SqlStatement statement, SearchDeadline deadline) {
        deadline.ensureRemaining(operation);
        try {
            return jdbcTemplate.query(statement.sql(), new DeadlineStatementSetter(statement, deadline), rowMapper);
        } catch (DataAccessException ex) {
            throw new CandidateStoreException(operation + " failed", ex);
        }
    }

    private long count(String operation, SqlStatement statement, SearchDeadline deadline) {
        deadline.ensureRemaining(operation);
        try {
            Long total = jdbcTemplate.query(
                statement.sql(),
                new DeadlineStatementSetter(statement, deadline),
                rs -> rs.next() ? rs.getLong(1) : 0L
            );
            return total == null ? 0L : total;
        } catch (DataAccessException ex) {
            throw new CandidateStoreException(operation + " failed", ex);
        }
    }
}
