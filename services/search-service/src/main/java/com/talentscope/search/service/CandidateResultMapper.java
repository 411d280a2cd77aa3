package com.talentscope.search.service;

import com.talentscope.search.api.dto.CandidateSearchResult;
import com.talentscope.search.retrieval.RankedCandidate;
import com.talentscope.search.store.CandidateRow;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class CandidateResultMapper {
    static final int HIGH_CONFIDENCE = 95;
    static final int MEDIUM_CONFIDENCE = 80;

    public CandidateSearchResult toResult(RankedCandidate candidate) {
        CandidateRow row = candidate.row();
        int aiConfidence = toPercent(row.getConfidenceScore() == null ? 0.0 : row.getConfidenceScore());

        CandidateSearchResult result = new CandidateSearchResult();
        result.setId(row.getId());
        result.setName(row.getName());
        result.setRole(row.getLastPosition());
        result.setCompany(row.getLastCompany());
        result.setExpYears(row.getExpYears() == null ? 0 : row.getExpYears());
        result.setSkills(row.getSkills() == null ? List.of() : row.getSkills());
        result.setPhotoUrl(row.getPhotoUrl());
        result.setSummary(row.getSummary());
        result.setAiConfidence(aiConfidence);
        result.setConfidenceLevel(confidenceLevel(aiConfidence));
        result.setRiskLevel(row.getRiskLevel() == null ? "low" : row.getRiskLevel());
        result.setRequiresReview(row.isRequiresReview());
        result.setCreatedAt(row.getCreatedAt());
        result.setUpdatedAt(row.getUpdatedAt());
        result.setMatchScore(toPercent(candidate.score()));
        result.setMatchedChunks(new ArrayList<>());
        return result;
    }

    public List<CandidateSearchResult> toResults(List<RankedCandidate> candidates) {
        List<CandidateSearchResult> results = new ArrayList<>(candidates.size());
        for (RankedCandidate candidate : candidates) {
            results.add(toResult(candidate));
        }
        return results;
    }

    static String confidenceLevel(int aiConfidence) {
        if (aiConfidence >= HIGH_CONFIDENCE) {
            return "high";
        }
        if (aiConfidence >= MEDIUM_CONFIDENCE) {
            return "medium";
        }
        return "low";
    }

    static int toPercent(double value) {
        double clamped = Math.max(0.0, Math.min(1.0, value));
        return (int) Math.round(clamped * 100);
    }
}
