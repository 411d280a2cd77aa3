package com.talentscope.search.service;

import com.talentscope.search.api.dto.CandidateSearchResult;
import com.talentscope.search.config.SearchProperties;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Adds a one-line explanation to the top results: the skills that matched a parsed keyword, or a
 * generic reason based on the match score.
 */
@Component
public class MatchReasonBuilder {
    static final int STRONG_MATCH_SCORE = 90;

    private final SearchProperties properties;

    public MatchReasonBuilder(SearchProperties properties) {
        this.properties = properties;
    }

    public void annotate(List<CandidateSearchResult> results, List<String> keywords) {
        int topN = Math.min(results.size(), Math.max(0, properties.getMatchReasonTopN()));
        List<String> needles = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            needles.add(keyword.toLowerCase(Locale.ROOT));
        }
        for (int i = 0; i < topN; i++) {
            CandidateSearchResult result = results.get(i);
            result.setMatchReason(reasonFor(result, needles));
        }
    }

    static String reasonFor(CandidateSearchResult result, List<String> needles) {
        List<String> matchedSkills = new ArrayList<>();
        if (result.getSkills() != null) {
            for (String skill : result.getSkills()) {
                String lower = skill.toLowerCase(Locale.ROOT);
                for (String needle : needles) {
                    if (lower.contains(needle)) {
                        matchedSkills.add(skill);
                        break;
                    }
                }
            }
        }
        if (!matchedSkills.isEmpty()) {
            return "Has the searched skills (" + String.join(", ", matchedSkills) + ")";
        }
        if (result.getMatchScore() >= STRONG_MATCH_SCORE) {
            return "Closely matches the preferred experience and skills";
        }
        return "Related keywords and patterns found in the resume";
    }
}
