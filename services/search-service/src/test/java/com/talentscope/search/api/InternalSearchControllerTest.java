package com.talentscope.search.api;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.talentscope.search.service.CandidateSearchService;
import com.talentscope.search.synonym.SynonymService;
import com.talentscope.search.synonym.SynonymStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(InternalSearchController.class)
class InternalSearchControllerTest {
    private static final String USER_ID = "7b0c1f7e-3f7a-4c55-9d1e-2a6f0a1d9e11";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CandidateSearchService searchService;

    @MockBean
    private SynonymService synonymService;

    @Test
    void invalidateReturnsDeletedCount() throws Exception {
        when(searchService.invalidateCaller(USER_ID)).thenReturn(3L);

        mockMvc.perform(post("/internal/search/cache/invalidate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"" + USER_ID.toUpperCase() + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.deleted").value(3));
    }

    @Test
    void invalidateRejectsNonUuid() throws Exception {
        mockMvc.perform(post("/internal/search/cache/invalidate")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\":\"search:*\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));

        verifyNoInteractions(searchService);
    }

    @Test
    void synonymStatusIsExposed() throws Exception {
        when(synonymService.status()).thenReturn(new SynonymStatus(true, false, 2, 5, "2026-01-05T10:00:00Z", 1000L));

        mockMvc.perform(get("/internal/synonyms/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.loaded").value(true))
            .andExpect(jsonPath("$.data.variantCount").value(5));
    }
}
