package com.talentscope.search.config;

import com.talentscope.search.planner.SkillStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search")
public class SearchProperties {
    private int semanticQueryThreshold = 10;
    private SkillStrategy skillStrategy = SkillStrategy.PARALLEL_GROUPS;
    private int parallelMinSkills = 2;
    private int maxSkillGroups = 5;
    private int maxTermsPerGroup = 15;
    private int maxTotalSkillTerms = 75;
    private int maxKeywordTerms = 50;
    private int groupFetchPadding = 10;
    private int maxResultWindow = 1000;
    private long timeoutMs = 5000;
    private long fallbackFloorMs = 1500;
    private int maxSkillsPerCandidate = 100;
    private int matchReasonTopN = 5;

    public int getSemanticQueryThreshold() {
        return semanticQueryThreshold;
    }

    public void setSemanticQueryThreshold(int semanticQueryThreshold) {
        this.semanticQueryThreshold = semanticQueryThreshold;
    }

    public SkillStrategy getSkillStrategy() {
        return skillStrategy;
    }

    public void setSkillStrategy(SkillStrategy skillStrategy) {
        this.skillStrategy = skillStrategy;
    }

    public int getParallelMinSkills() {
        return parallelMinSkills;
    }

    public void setParallelMinSkills(int parallelMinSkills) {
        this.parallelMinSkills = parallelMinSkills;
    }

    public int getMaxSkillGroups() {
        return maxSkillGroups;
    }

    public void setMaxSkillGroups(int maxSkillGroups) {
        this.maxSkillGroups = maxSkillGroups;
    }

    public int getMaxTermsPerGroup() {
        return maxTermsPerGroup;
    }

    public void setMaxTermsPerGroup(int maxTermsPerGroup) {
        this.maxTermsPerGroup = maxTermsPerGroup;
    }

    public int getMaxTotalSkillTerms() {
        return maxTotalSkillTerms;
    }

    public void setMaxTotalSkillTerms(int maxTotalSkillTerms) {
        this.maxTotalSkillTerms = maxTotalSkillTerms;
    }

    public int getMaxKeywordTerms() {
        return maxKeywordTerms;
    }

    public void setMaxKeywordTerms(int maxKeywordTerms) {
        this.maxKeywordTerms = maxKeywordTerms;
    }

    public int getGroupFetchPadding() {
        return groupFetchPadding;
    }

    public void setGroupFetchPadding(int groupFetchPadding) {
        this.groupFetchPadding = groupFetchPadding;
    }

    public int getMaxResultWindow() {
        return maxResultWindow;
    }

    public void setMaxResultWindow(int maxResultWindow) {
        this.maxResultWindow = maxResultWindow;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public long getFallbackFloorMs() {
        return fallbackFloorMs;
    }

    public void setFallbackFloorMs(long fallbackFloorMs) {
        this.fallbackFloorMs = fallbackFloorMs;
    }

    public int getMaxSkillsPerCandidate() {
        return maxSkillsPerCandidate;
    }

    public void setMaxSkillsPerCandidate(int maxSkillsPerCandidate) {
        this.maxSkillsPerCandidate = maxSkillsPerCandidate;
    }

    public int getMatchReasonTopN() {
        return matchReasonTopN;
    }

    public void setMatchReasonTopN(int matchReasonTopN) {
        this.matchReasonTopN = matchReasonTopN;
    }
}
