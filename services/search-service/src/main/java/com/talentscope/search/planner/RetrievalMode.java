package com.talentscope.search.planner;

public enum RetrievalMode {
    KEYWORD,
    SEMANTIC
}
