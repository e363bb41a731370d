package ch.so.arp.hybrid.retrieval;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class EvaluationControllerTest {

    @Test
    void returnsEvaluationReport() throws Exception {
        RetrievalEvaluator evaluator = mock(RetrievalEvaluator.class);
        EvaluationReport.QueryEvaluation evaluation = new EvaluationReport.QueryEvaluation("Q-001", "login error",
                "exact_match", List.of("KB-0001"), List.of("KB-0001"), Set.of(), 1.0d, 1.0d, 1.0d);
        EvaluationReport.MetricSummary summary = new EvaluationReport.MetricSummary(1, 1.0d, 1.0d, 1.0d);
        when(evaluator.evaluate()).thenReturn(
                new EvaluationReport(List.of(evaluation), Map.of("exact_match", summary), summary));
        MockMvc mockMvc = MockMvcBuilders.standaloneSetup(new EvaluationController(evaluator)).build();

        mockMvc.perform(post("/api/evaluation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.queries[0].query_id").value("Q-001"))
                .andExpect(jsonPath("$.queries[0].recall_at_5").value(1.0d))
                .andExpect(jsonPath("$.categories.exact_match.queries").value(1))
                .andExpect(jsonPath("$.overall.mrr").value(1.0d));
    }
}
