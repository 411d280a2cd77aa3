package com.talentscope.search.store;

import com.talentscope.search.common.JdbcUtils;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.RowMapper;

/**
 * Maps candidate rows from plain queries and from the search RPCs. The {@code match_score}
 * column is only present on vector RPC results. Skill arrays are bounded on read.
 */
public class CandidateRowMapper implements RowMapper<CandidateRow> {
    private final int maxSkills;

    public CandidateRowMapper(int maxSkills) {
        this.maxSkills = Math.max(1, maxSkills);
    }

    @Override
    public CandidateRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        CandidateRow row = new CandidateRow();
        row.setId(JdbcUtils.asString(rs.getObject("id")));
        row.setName(rs.getString("name"));
        row.setLastPosition(rs.getString("last_position"));
        row.setLastCompany(rs.getString("last_company"));
        row.setExpYears(JdbcUtils.asInt(rs.getObject("exp_years")));
        row.setSkills(boundSkills(JdbcUtils.asStringList(rs.getObject("skills"))));
        row.setPhotoUrl(rs.getString("photo_url"));
        row.setSummary(rs.getString("summary"));
        row.setConfidenceScore(JdbcUtils.asDouble(rs.getObject("confidence_score")));
        row.setRequiresReview(JdbcUtils.asBoolean(rs.getObject("requires_review")));
        row.setRiskLevel(JdbcUtils.asString(rs.getObject("risk_level")));
        row.setCreatedAt(JdbcUtils.asIsoString(rs.getObject("created_at")));
        row.setUpdatedAt(JdbcUtils.asIsoString(rs.getObject("updated_at")));
        if (hasColumn(rs.getMetaData(), "match_score")) {
            row.setMatchScore(JdbcUtils.asDouble(rs.getObject("match_score")));
        }
        return row;
    }

    List<String> boundSkills(List<String> raw) {
        List<String> skills = new ArrayList<>(Math.min(raw.size(), maxSkills));
        for (String skill : raw) {
            if (skills.size() >= maxSkills) {
                break;
            }
            if (skill != null && !skill.isBlank()) {
                skills.add(skill.trim());
            }
        }
        return skills;
    }

    private boolean hasColumn(ResultSetMetaData metaData, String column) throws SQLException {
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            if (column.equalsIgnoreCase(metaData.getColumnLabel(i))) {
                return true;
            }
        }
        return false;
    }
}
