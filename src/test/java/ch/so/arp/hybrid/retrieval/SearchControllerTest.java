package ch.so.arp.hybrid.retrieval;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class SearchControllerTest {

    private static final SearchResult HIT = new SearchResult("KB-0001", "Resolving error E-4012 during login",
            "Sign in again.", "EU", "v2.0", "authentication", false, 0.032d, 1);

    private HybridRetrievalService retrievalService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        retrievalService = mock(HybridRetrievalService.class);
        SearchController controller = new SearchController(retrievalService, new RetrievalProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void runsHybridSearchWithParsedFilter() throws Exception {
        FilterPredicate expected = FilterPredicate.and(
                FilterPredicate.eq(FilterField.REGION, "EU"),
                FilterPredicate.eq(FilterField.DEPRECATED, false));
        when(retrievalService.search(SearchMode.HYBRID, "login error", 3, expected))
                .thenReturn(new SearchOutcome(SearchMode.HYBRID, List.of(HIT), Set.of()));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query": "login error", "top_k": 3,
                                 "filter": {"$and": [{"region": {"$eq": "EU"}}, {"deprecated": false}]}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("HYBRID"))
                .andExpect(jsonPath("$.results[0].doc_id").value("KB-0001"))
                .andExpect(jsonPath("$.results[0].product_version").value("v2.0"))
                .andExpect(jsonPath("$.results[0].rank").value(1))
                .andExpect(jsonPath("$.fallbacks").isEmpty());
    }

    @Test
    void appliesDefaultTopKAndReportsFallbacks() throws Exception {
        when(retrievalService.search(eq(SearchMode.SPARSE), eq("invoice"), eq(5), isNull()))
                .thenReturn(new SearchOutcome(SearchMode.SPARSE, List.of(HIT),
                        EnumSet.of(FallbackStage.SPARSE_FILTER_DROPPED)));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"invoice\", \"mode\": \"SPARSE\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mode").value("SPARSE"))
                .andExpect(jsonPath("$.fallbacks[0]").value("SPARSE_FILTER_DROPPED"));
        verify(retrievalService).search(SearchMode.SPARSE, "invoice", 5, null);
    }

    @Test
    void convertsExtractedFilters() throws Exception {
        FilterPredicate expected = FilterPredicate.and(
                FilterPredicate.eq(FilterField.CATEGORY, "billing"),
                FilterPredicate.of(FilterField.ERROR_CODES, FilterOperator.CONTAINS, "E-7001"));
        when(retrievalService.search("invoice failed", 2, expected))
                .thenReturn(new SearchOutcome(SearchMode.HYBRID, List.of(), Set.of()));

        mockMvc.perform(post("/api/search/extracted")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query": "invoice failed", "top_k": 2,
                                 "filters": {"category": "billing", "error_codes": "E-7001"}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results").isEmpty());
        verify(retrievalService).search("invoice failed", 2, expected);
    }

    @Test
    void rejectsMalformedFilter() throws Exception {
        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"login\", \"filter\": {\"colour\": {\"$eq\": \"red\"}}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("malformed_predicate"));
        verifyNoInteractions(retrievalService);
    }

    @Test
    void rejectsBlankQueryAndNonPositiveTopK() throws Exception {
        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));
        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"login\", \"top_k\": 0}"))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(retrievalService);
    }

    @Test
    void mapsUnavailableIndexToServiceUnavailable() throws Exception {
        when(retrievalService.search(any(SearchMode.class), anyString(), anyInt(), any()))
                .thenThrow(new IndexUnavailableException("Corpus index has not been built yet"));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"login\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("index_unavailable"));
    }

    @Test
    void mapsVectorStoreFailureToBadGateway() throws Exception {
        when(retrievalService.search(any(SearchMode.class), anyString(), anyInt(), any()))
                .thenThrow(new VectorPortFailureException("Vector search timed out after 2000ms"));

        mockMvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\": \"login\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("vector_search_failed"))
                .andExpect(jsonPath("$.message").value("Vector search timed out after 2000ms"));
    }
}
