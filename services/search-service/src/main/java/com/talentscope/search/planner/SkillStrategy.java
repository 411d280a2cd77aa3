package com.talentscope.search.planner;

public enum SkillStrategy {
    PARALLEL_GROUPS,
    JOIN
}
