package com.talentscope.search.planner;

public record SearchPlan(RetrievalMode mode, boolean parallelSkills, SkillStrategy skillStrategy) {
    public boolean isSemantic() {
        return mode == RetrievalMode.SEMANTIC;
    }
}
