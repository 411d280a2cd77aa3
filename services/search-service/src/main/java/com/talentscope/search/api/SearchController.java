package com.talentscope.search.api;

import com.talentscope.search.api.dto.SearchApiResponse;
import com.talentscope.search.api.dto.SearchFeedbackRequest;
import com.talentscope.search.api.dto.SearchRequest;
import com.talentscope.search.feedback.SearchFeedbackService;
import com.talentscope.search.ratelimit.RateLimitGate;
import com.talentscope.search.ratelimit.RateLimitScope;
import com.talentscope.search.security.CallerIdentity;
import com.talentscope.search.security.CallerResolver;
import com.talentscope.search.service.CandidateSearchService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.HashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SearchController {
    private final CandidateSearchService searchService;
    private final SearchFeedbackService feedbackService;
    private final CallerResolver callerResolver;
    private final RateLimitGate rateLimitGate;

    public SearchController(
        CandidateSearchService searchService,
        SearchFeedbackService feedbackService,
        CallerResolver callerResolver,
        RateLimitGate rateLimitGate
    ) {
        this.searchService = searchService;
        this.feedbackService = feedbackService;
        this.callerResolver = callerResolver;
        this.rateLimitGate = rateLimitGate;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @PostMapping("/search")
    public SearchApiResponse search(
        @RequestBody(required = false) SearchRequest request,
        HttpServletRequest httpRequest
    ) {
        CallerIdentity caller = callerResolver.require(httpRequest);
        rateLimitGate.check(RateLimitScope.SEARCH, caller);
        return searchService.search(caller, request);
    }

    @PostMapping("/search/feedback")
    public Map<String, Object> feedback(
        @RequestBody(required = false) SearchFeedbackRequest request,
        HttpServletRequest httpRequest
    ) {
        CallerIdentity caller = callerResolver.require(httpRequest);
        rateLimitGate.check(RateLimitScope.FEEDBACK, caller);
        String id = feedbackService.submit(caller, request);
        Map<String, Object> data = new HashMap<>();
        data.put("id", id);
        return Map.of("data", data);
    }
}
