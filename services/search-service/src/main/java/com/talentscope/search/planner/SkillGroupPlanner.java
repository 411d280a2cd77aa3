package com.talentscope.search.planner;

import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.synonym.SynonymService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class SkillGroupPlanner {
    private final SynonymService synonymService;
    private final SearchProperties properties;

    public SkillGroupPlanner(SynonymService synonymService, SearchProperties properties) {
        this.synonymService = synonymService;
        this.properties = properties;
    }

    /**
     * Partitions skills into at most {@code maxSkillGroups} clusters. With no more skills than
     * groups each skill is its own cluster; otherwise skills are chunked evenly. Every cluster is
     * expanded on its own and capped per group and overall.
     */
    public SkillGroupPlan plan(List<String> skills, boolean expandSynonyms) {
        if (skills == null || skills.isEmpty()) {
            return SkillGroupPlan.empty();
        }
        int maxGroups = Math.max(1, properties.getMaxSkillGroups());
        int chunkSize = skills.size() <= maxGroups ? 1 : (int) Math.ceil(skills.size() / (double) maxGroups);
        int perGroupCap = Math.max(1, properties.getMaxTermsPerGroup());
        int remaining = Math.max(1, properties.getMaxTotalSkillTerms());

        List<List<String>> groups = new ArrayList<>();
        for (int start = 0; start < skills.size() && groups.size() < maxGroups && remaining > 0; start += chunkSize) {
            List<String> cluster = skills.subList(start, Math.min(skills.size(), start + chunkSize));
            List<String> terms = expandCluster(cluster, expandSynonyms, Math.min(perGroupCap, remaining));
            if (!terms.isEmpty()) {
                groups.add(terms);
                remaining -= terms.size();
            }
        }
        return new SkillGroupPlan(groups);
    }

    private List<String> expandCluster(List<String> cluster, boolean expandSynonyms, int cap) {
        if (expandSynonyms) {
            return synonymService.expandMany(cluster, cap);
        }
        List<String> terms = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String skill : cluster) {
            if (terms.size() >= cap) {
                break;
            }
            if (skill != null && !skill.isBlank() && seen.add(skill.toLowerCase(Locale.ROOT))) {
                terms.add(skill.trim());
            }
        }
        return terms;
    }
}
