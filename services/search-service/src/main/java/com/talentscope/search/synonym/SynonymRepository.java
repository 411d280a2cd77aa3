package com.talentscope.search.synonym;

import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class SynonymRepository {
    private final JdbcTemplate jdbcTemplate;

    public SynonymRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<SynonymPair> findAll(int limit) {
        return jdbcTemplate.query(
            "SELECT canonical_skill, variant FROM skill_synonyms "
                + "WHERE canonical_skill IS NOT NULL AND variant IS NOT NULL "
                + "ORDER BY canonical_skill ASC, variant ASC LIMIT ?",
            (rs, rowNum) -> new SynonymPair(rs.getString("canonical_skill"), rs.getString("variant")),
            limit
        );
    }
}
