package com.talentscope.search.retrieval;

import com.talentscope.search.store.CandidateRow;
import java.util.List;

public record SkillSearchResult(SearchPath path, List<CandidateRow> rows) {
}
