package com.talentscope.search.api;

import com.talentscope.search.api.dto.CacheInvalidateRequest;
import com.talentscope.search.service.CandidateSearchService;
import com.talentscope.search.synonym.SynonymService;
import com.talentscope.search.synonym.SynonymStatus;
import com.talentscope.search.validation.InvalidSearchRequestException;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints for other back-end services; not exposed through the public gateway.
 */
@RestController
@RequestMapping("/internal")
public class InternalSearchController {
    private final CandidateSearchService searchService;
    private final SynonymService synonymService;

    public InternalSearchController(CandidateSearchService searchService, SynonymService synonymService) {
        this.searchService = searchService;
        this.synonymService = synonymService;
    }

    @PostMapping("/search/cache/invalidate")
    public Map<String, Object> invalidateCache(@RequestBody(required = false) CacheInvalidateRequest request) {
        String userId = request == null ? null : request.getUserId();
        if (userId == null || !isUuid(userId.trim())) {
            throw new InvalidSearchRequestException("userId must be a valid UUID");
        }
        long deleted = searchService.invalidateCaller(UUID.fromString(userId.trim()).toString());
        return Map.of("data", Map.of("deleted", deleted));
    }

    @PostMapping("/synonyms/refresh")
    public Map<String, Object> refreshSynonyms() {
        return Map.of("data", synonymService.refresh());
    }

    @GetMapping("/synonyms/status")
    public Map<String, Object> synonymStatus() {
        SynonymStatus status = synonymService.status();
        return Map.of("data", status);
    }

    private static boolean isUuid(String value) {
        try {
            UUID.fromString(value);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }
}
