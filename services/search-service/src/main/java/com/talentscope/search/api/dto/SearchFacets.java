package com.talentscope.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchFacets {
    private List<FacetItem> skills = List.of();
    private List<FacetItem> companies = List.of();
    private Map<String, Integer> expYears = new LinkedHashMap<>();

    public List<FacetItem> getSkills() {
        return skills;
    }

    public void setSkills(List<FacetItem> skills) {
        this.skills = skills;
    }

    public List<FacetItem> getCompanies() {
        return companies;
    }

    public void setCompanies(List<FacetItem> companies) {
        this.companies = companies;
    }

    public Map<String, Integer> getExpYears() {
        return expYears;
    }

    public void setExpYears(Map<String, Integer> expYears) {
        this.expYears = expYears;
    }
}
