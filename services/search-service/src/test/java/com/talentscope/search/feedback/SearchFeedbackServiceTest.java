package com.talentscope.search.feedback;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.talentscope.search.api.dto.SearchFeedbackRequest;
import com.talentscope.search.security.CallerIdentity;
import com.talentscope.search.validation.InvalidSearchRequestException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SearchFeedbackServiceTest {
    private static final CallerIdentity CALLER = new CallerIdentity("7b0c1f7e-3f7a-4c55-9d1e-2a6f0a1d9e11");
    private static final String CANDIDATE_ID = "2f1d1b8e-8a59-4f47-a3a4-6e1b7cbe6a10";

    @Mock
    private SearchFeedbackRepository repository;

    @Test
    void submitStoresNormalizedFeedback() {
        when(repository.insert(eq(CALLER.userId()), any(SearchFeedback.class))).thenReturn("fb-1");
        SearchFeedbackService service = new SearchFeedbackService(repository);

        String id = service.submit(CALLER, request(" " + CANDIDATE_ID + " ", "  React\u0000 dev ", "contacted"));

        assertEquals("fb-1", id);
        ArgumentCaptor<SearchFeedback> captor = ArgumentCaptor.forClass(SearchFeedback.class);
        verify(repository).insert(eq(CALLER.userId()), captor.capture());
        SearchFeedback stored = captor.getValue();
        assertEquals(CANDIDATE_ID, stored.candidateId());
        assertEquals("React dev", stored.searchQuery());
        assertEquals(FeedbackType.CONTACTED, stored.feedbackType());
        assertEquals(0, stored.resultPosition());
        assertEquals(0, stored.relevanceScore());
    }

    @Test
    void rejectsInvalidFields() {
        SearchFeedbackService service = new SearchFeedbackService(repository);

        assertRejected(service, request("not-a-uuid", "Java", "clicked"), "candidateId must be a valid UUID");
        assertRejected(service, request(CANDIDATE_ID, " \u0007 ", "clicked"), "searchQuery is required");
        assertRejected(service, request(CANDIDATE_ID, "x".repeat(501), "clicked"), "searchQuery must be at most 500 characters");
        assertRejected(service, request(CANDIDATE_ID, "Java", "liked"), "feedbackType must be one of relevant, not_relevant, clicked, contacted");

        SearchFeedbackRequest position = request(CANDIDATE_ID, "Java", "clicked");
        position.setResultPosition(1001);
        assertRejected(service, position, "resultPosition must be between 0 and 1000");

        SearchFeedbackRequest relevance = request(CANDIDATE_ID, "Java", "relevant");
        relevance.setRelevanceScore(-1);
        assertRejected(service, relevance, "relevanceScore must be between 0 and 100");

        assertRejected(service, null, "request body is required");
        verifyNoInteractions(repository);
    }

    private static void assertRejected(SearchFeedbackService service, SearchFeedbackRequest request, String message) {
        assertThatThrownBy(() -> service.submit(CALLER, request))
            .isInstanceOf(InvalidSearchRequestException.class)
            .hasMessage(message);
    }

    private static SearchFeedbackRequest request(String candidateId, String query, String type) {
        SearchFeedbackRequest request = new SearchFeedbackRequest();
        request.setCandidateId(candidateId);
        request.setSearchQuery(query);
        request.setFeedbackType(type);
        return request;
    }
}
