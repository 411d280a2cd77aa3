package com.talentscope.search.validation;

public final class SearchLimits {
    public static final int MAX_QUERY_LENGTH = 500;
    public static final int MAX_KEYWORD_LENGTH = 50;
    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 100;
    public static final int DEFAULT_LIMIT = 20;
    public static final int MIN_OFFSET = 0;
    public static final int MAX_OFFSET = Integer.MAX_VALUE - MAX_LIMIT;
    public static final int MIN_EXP_YEARS = 0;
    public static final int MAX_EXP_YEARS = 100;
    public static final int MAX_SKILLS = 20;
    public static final int MAX_SKILL_LENGTH = 50;
    public static final int MAX_LOCATION_LENGTH = 100;
    public static final int MAX_COMPANIES = 10;
    public static final int MAX_COMPANY_LENGTH = 100;
    public static final int MAX_EDUCATION_LEVEL_LENGTH = 50;

    private SearchLimits() {
    }
}
