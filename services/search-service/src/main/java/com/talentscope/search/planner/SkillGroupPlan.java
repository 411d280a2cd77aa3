package com.talentscope.search.planner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Skill filter split into bounded, synonym-expanded groups for parallel sub-queries.
 */
public class SkillGroupPlan {
    private final List<List<String>> groups;

    public SkillGroupPlan(List<List<String>> groups) {
        List<List<String>> copy = new ArrayList<>(groups.size());
        for (List<String> group : groups) {
            copy.add(List.copyOf(group));
        }
        this.groups = Collections.unmodifiableList(copy);
    }

    public static SkillGroupPlan empty() {
        return new SkillGroupPlan(List.of());
    }

    public List<List<String>> getGroups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /**
     * Groups padded with {@code null} up to {@code slots}, matching the fixed-arity vector RPC.
     */
    public List<List<String>> paddedTo(int slots) {
        List<List<String>> padded = new ArrayList<>(slots);
        for (int i = 0; i < slots; i++) {
            padded.add(i < groups.size() ? groups.get(i) : null);
        }
        return padded;
    }

    public List<String> allTerms() {
        Set<String> terms = new LinkedHashSet<>();
        for (List<String> group : groups) {
            terms.addAll(group);
        }
        return new ArrayList<>(terms);
    }
}
