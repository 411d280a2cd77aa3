package com.talentscope.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchFilters {
    private Integer expYearsMin;
    private Integer expYearsMax;
    private List<String> skills;
    private String location;
    private List<String> companies;
    private List<String> excludeCompanies;
    private String educationLevel;
    private Boolean expandSynonyms;

    public Integer getExpYearsMin() {
        return expYearsMin;
    }

    public void setExpYearsMin(Integer expYearsMin) {
        this.expYearsMin = expYearsMin;
    }

    public Integer getExpYearsMax() {
        return expYearsMax;
    }

    public void setExpYearsMax(Integer expYearsMax) {
        this.expYearsMax = expYearsMax;
    }

    public List<String> getSkills() {
        return skills;
    }

    public void setSkills(List<String> skills) {
        this.skills = skills;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public List<String> getCompanies() {
        return companies;
    }

    public void setCompanies(List<String> companies) {
        this.companies = companies;
    }

    public List<String> getExcludeCompanies() {
        return excludeCompanies;
    }

    public void setExcludeCompanies(List<String> excludeCompanies) {
        this.excludeCompanies = excludeCompanies;
    }

    public String getEducationLevel() {
        return educationLevel;
    }

    public void setEducationLevel(String educationLevel) {
        this.educationLevel = educationLevel;
    }

    public Boolean getExpandSynonyms() {
        return expandSynonyms;
    }

    public void setExpandSynonyms(Boolean expandSynonyms) {
        this.expandSynonyms = expandSynonyms;
    }
}
