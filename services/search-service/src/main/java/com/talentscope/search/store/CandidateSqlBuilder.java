package com.talentscope.search.store;

import com.talentscope.search.validation.CandidateFilters;
import com.talentscope.search.validation.QueryEscaper;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.jdbc.support.SqlArrayValue;

/**
 * Builds parameterized candidate queries. Every user-supplied value is bound as a parameter;
 * pattern values go through {@link QueryEscaper#escapeLikePattern} and array elements through
 * {@link QueryEscaper#sanitizeArrayValue} first.
 */
public final class CandidateSqlBuilder {
    static final String COLUMNS = "id, name, last_position, last_company, exp_years, skills, photo_url, "
        + "summary, confidence_score, requires_review, risk_level, created_at, updated_at";
    private static final String ORDER_BY_CONFIDENCE = "ORDER BY confidence_score DESC NULLS LAST, id ASC ";

    private CandidateSqlBuilder() {
    }

    public static SqlStatement keywordSearch(CandidateFilterQuery query) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM candidates ");
        List<Object> params = new ArrayList<>();
        appendKeywordWhere(sql, params, query);
        sql.append(ORDER_BY_CONFIDENCE).append("LIMIT ? OFFSET ?");
        params.add(query.limit());
        params.add(query.offset());
        return new SqlStatement(sql.toString(), params);
    }

    public static SqlStatement keywordCount(CandidateFilterQuery query) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM candidates ");
        List<Object> params = new ArrayList<>();
        appendKeywordWhere(sql, params, query);
        return new SqlStatement(sql.toString().trim(), params);
    }

    public static SqlStatement fallbackSearch(String userId, String queryText, CandidateFilters filters, int limit, int offset) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM candidates ");
        List<Object> params = new ArrayList<>();
        appendFallbackWhere(sql, params, userId, queryText, filters);
        sql.append(ORDER_BY_CONFIDENCE).append("LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);
        return new SqlStatement(sql.toString(), params);
    }

    public static SqlStatement fallbackCount(String userId, String queryText, CandidateFilters filters) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM candidates ");
        List<Object> params = new ArrayList<>();
        appendFallbackWhere(sql, params, userId, queryText, filters);
        return new SqlStatement(sql.toString().trim(), params);
    }

    /**
     * One parallel sub-query: candidates whose skills overlap a single synonym group.
     */
    public static SqlStatement skillGroupSearch(String userId, List<String> groupTerms, CandidateFilters filters, int limit) {
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM candidates ");
        List<Object> params = new ArrayList<>();
        appendBaseWhere(sql, params, userId);
        appendFilters(sql, params, filters, groupTerms);
        sql.append(ORDER_BY_CONFIDENCE).append("LIMIT ?");
        params.add(limit);
        return new SqlStatement(sql.toString(), params);
    }

    public static SqlStatement vectorSearch(SingleGroupVectorQuery query) {
        String sql = "SELECT * FROM search_candidates("
            + "p_user_id => ?::uuid, "
            + "p_query_embedding => ?::vector, "
            + "p_match_count => ?::int, "
            + "p_exp_years_min => ?::int, "
            + "p_exp_years_max => ?::int, "
            + "p_skills => ?::text[], "
            + "p_location => ?::text, "
            + "p_companies => ?::text[], "
            + "p_exclude_companies => ?::text[], "
            + "p_education_level => ?::text)";
        List<Object> params = new ArrayList<>();
        params.add(query.userId());
        params.add(vectorLiteral(query.embedding()));
        params.add(query.matchCount());
        params.add(query.expYearsMin());
        params.add(query.expYearsMax());
        params.add(textArrayOrNull(query.skills()));
        params.add(query.location());
        params.add(textArrayOrNull(query.companies()));
        params.add(textArrayOrNull(query.excludeCompanies()));
        params.add(query.educationLevel());
        return new SqlStatement(sql, params);
    }

    public static SqlStatement parallelVectorSearch(ParallelGroupVectorQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM search_candidates_parallel(")
            .append("p_user_id => ?::uuid, ")
            .append("p_query_embedding => ?::vector, ")
            .append("p_match_count => ?::int, ")
            .append("p_exp_years_min => ?::int, ")
            .append("p_exp_years_max => ?::int, ");
        List<Object> params = new ArrayList<>();
        params.add(query.userId());
        params.add(vectorLiteral(query.embedding()));
        params.add(query.matchCount());
        params.add(query.expYearsMin());
        params.add(query.expYearsMax());
        for (int slot = 0; slot < ParallelGroupVectorQuery.SKILL_GROUP_SLOTS; slot++) {
            sql.append("p_skill_group_").append(slot + 1).append(" => ?::text[], ");
            params.add(textArrayOrNull(query.skillGroups().get(slot)));
        }
        sql.append("p_location => ?::text, ")
            .append("p_companies => ?::text[], ")
            .append("p_exclude_companies => ?::text[], ")
            .append("p_education_level => ?::text)");
        params.add(query.location());
        params.add(textArrayOrNull(query.companies()));
        params.add(textArrayOrNull(query.excludeCompanies()));
        params.add(query.educationLevel());
        return new SqlStatement(sql.toString(), params);
    }

    public static SqlStatement skillJoinSearch(SkillJoinQuery query) {
        String sql = "SELECT * FROM search_candidates_by_skills("
            + "p_user_id => ?::uuid, "
            + "p_skills => ?::text[], "
            + "p_match_count => ?::int, "
            + "p_exp_years_min => ?::int, "
            + "p_exp_years_max => ?::int, "
            + "p_location => ?::text, "
            + "p_companies => ?::text[], "
            + "p_exclude_companies => ?::text[])";
        List<Object> params = new ArrayList<>();
        params.add(query.userId());
        params.add(textArrayOrNull(query.skills()));
        params.add(query.matchCount());
        params.add(query.expYearsMin());
        params.add(query.expYearsMax());
        params.add(query.location());
        params.add(textArrayOrNull(query.companies()));
        params.add(textArrayOrNull(query.excludeCompanies()));
        return new SqlStatement(sql, params);
    }

    static String vectorLiteral(List<Double> embedding) {
        if (embedding == null || embedding.isEmpty()) {
            throw new IllegalArgumentException("embedding must not be empty");
        }
        return embedding.stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
    }

    private static void appendKeywordWhere(StringBuilder sql, List<Object> params, CandidateFilterQuery query) {
        appendBaseWhere(sql, params, query.userId());
        appendKeywordMatch(sql, params, query.keywordTerms());
        appendFilters(sql, params, query.filters(), query.skillTerms());
    }

    private static void appendFallbackWhere(
        StringBuilder sql,
        List<Object> params,
        String userId,
        String queryText,
        CandidateFilters filters
    ) {
        appendBaseWhere(sql, params, userId);
        sql.append("AND (summary ILIKE ? OR last_position ILIKE ?) ");
        String pattern = QueryEscaper.containsPattern(queryText);
        params.add(pattern);
        params.add(pattern);
        appendFilters(sql, params, filters, filters.skills());
    }

    private static void appendBaseWhere(StringBuilder sql, List<Object> params, String userId) {
        sql.append("WHERE user_id = ?::uuid AND status = 'completed' AND is_latest = true ");
        params.add(userId);
    }

    private static void appendKeywordMatch(StringBuilder sql, List<Object> params, List<String> terms) {
        List<String> predicates = new ArrayList<>();
        for (String term : terms) {
            if (term == null || term.isBlank()) {
                continue;
            }
            String arrayValue = QueryEscaper.sanitizeArrayValue(term);
            if (!arrayValue.isEmpty()) {
                predicates.add("skills @> ARRAY[?]::text[]");
                params.add(arrayValue);
            }
            String pattern = QueryEscaper.containsPattern(term);
            predicates.add("last_position ILIKE ?");
            predicates.add("last_company ILIKE ?");
            predicates.add("name ILIKE ?");
            params.add(pattern);
            params.add(pattern);
            params.add(pattern);
        }
        if (!predicates.isEmpty()) {
            sql.append("AND (").append(String.join(" OR ", predicates)).append(") ");
        }
    }

    private static void appendFilters(StringBuilder sql, List<Object> params, CandidateFilters filters, List<String> skillTerms) {
        if (filters.expYearsMin() != null) {
            sql.append("AND exp_years >= ? ");
            params.add(filters.expYearsMin());
        }
        if (filters.expYearsMax() != null) {
            sql.append("AND exp_years <= ? ");
            params.add(filters.expYearsMax());
        }
        SqlArrayValue skills = textArrayOrNull(skillTerms);
        if (skills != null) {
            sql.append("AND skills && ?::text[] ");
            params.add(skills);
        }
        if (filters.location() != null) {
            sql.append("AND location_city ILIKE ? ");
            params.add(QueryEscaper.containsPattern(filters.location()));
        }
        if (!filters.companies().isEmpty()) {
            List<String> predicates = new ArrayList<>();
            for (String company : filters.companies()) {
                predicates.add("last_company ILIKE ?");
                params.add(QueryEscaper.containsPattern(company));
            }
            sql.append("AND (").append(String.join(" OR ", predicates)).append(") ");
        }
        for (String company : filters.excludeCompanies()) {
            sql.append("AND NOT (COALESCE(last_company, '') ILIKE ?) ");
            params.add(QueryEscaper.containsPattern(company));
        }
        if (filters.educationLevel() != null) {
            sql.append("AND education_level = ? ");
            params.add(filters.educationLevel());
        }
    }

    static SqlArrayValue textArrayOrNull(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        List<String> sanitized = new ArrayList<>(values.size());
        for (String value : values) {
            String cleaned = QueryEscaper.sanitizeArrayValue(value);
            if (!cleaned.isEmpty()) {
                sanitized.add(cleaned);
            }
        }
        return sanitized.isEmpty() ? null : new SqlArrayValue("text", sanitized.toArray());
    }
}
