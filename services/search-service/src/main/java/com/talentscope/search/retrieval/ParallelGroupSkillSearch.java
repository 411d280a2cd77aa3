package com.talentscope.search.retrieval;

import com.talentscope.search.config.SearchProperties;
import com.talentscope.search.execution.ParallelTaskGroup;
import com.talentscope.search.store.CandidateRow;
import com.talentscope.search.store.CandidateSearchRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.springframework.stereotype.Component;

@Component
public class ParallelGroupSkillSearch implements SkillSearchStrategy {
    static final Comparator<CandidateRow> BY_CONFIDENCE = Comparator
        .comparing((CandidateRow row) -> row.getConfidenceScore() == null ? 0.0 : row.getConfidenceScore())
        .reversed()
        .thenComparing(CandidateRow::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final CandidateSearchRepository repository;
    private final ParallelTaskGroup parallelTaskGroup;
    private final SearchProperties properties;

    public ParallelGroupSkillSearch(
        CandidateSearchRepository repository,
        ParallelTaskGroup parallelTaskGroup,
        SearchProperties properties
    ) {
        this.repository = repository;
        this.parallelTaskGroup = parallelTaskGroup;
        this.properties = properties;
    }

    @Override
    public SkillSearchResult search(SkillSearchRequest request) {
        List<List<String>> groups = request.groups().getGroups();
        if (groups.isEmpty()) {
            return new SkillSearchResult(SearchPath.KEYWORD_PARALLEL_GROUPS, List.of());
        }
        int fetchCount = Math.min(request.fetchCount(), Math.max(1, properties.getMaxResultWindow()));
        int perGroupLimit = (int) Math.ceil(fetchCount / (double) groups.size())
            + properties.getGroupFetchPadding();

        List<Callable<List<CandidateRow>>> tasks = new ArrayList<>(groups.size());
        for (List<String> group : groups) {
            tasks.add(() -> repository.findBySkillGroup(
                request.userId(), group, request.filters(), perGroupLimit, request.deadline()
            ));
        }
        List<List<CandidateRow>> perGroup = parallelTaskGroup.invokeAll("skill_group_search", tasks, request.deadline());
        return new SkillSearchResult(SearchPath.KEYWORD_PARALLEL_GROUPS, merge(perGroup));
    }

    static List<CandidateRow> merge(List<List<CandidateRow>> perGroup) {
        Map<String, CandidateRow> unique = new LinkedHashMap<>();
        for (List<CandidateRow> rows : perGroup) {
            for (CandidateRow row : rows) {
                unique.putIfAbsent(row.getId(), row);
            }
        }
        List<CandidateRow> merged = new ArrayList<>(unique.values());
        merged.sort(BY_CONFIDENCE);
        return merged;
    }
}
