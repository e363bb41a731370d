package ch.so.arp.hybrid.retrieval;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Retrieval quality of one evaluation run: per query, per category and over
 * all queries.
 */
public record EvaluationReport(
        @JsonProperty("queries") List<QueryEvaluation> queries,
        @JsonProperty("categories") Map<String, MetricSummary> categories,
        @JsonProperty("overall") MetricSummary overall) {

    public record QueryEvaluation(
            @JsonProperty("query_id") String queryId,
            @JsonProperty("query") String query,
            @JsonProperty("category") String category,
            @JsonProperty("expected_doc_ids") List<String> expectedDocIds,
            @JsonProperty("retrieved_doc_ids") List<String> retrievedDocIds,
            @JsonProperty("fallbacks") Set<FallbackStage> fallbacks,
            @JsonProperty("recall_at_5") double recallAt5,
            @JsonProperty("recall_at_10") double recallAt10,
            @JsonProperty("reciprocal_rank") double reciprocalRank) {
    }

    public record MetricSummary(
            @JsonProperty("queries") int queries,
            @JsonProperty("recall_at_5") double recallAt5,
            @JsonProperty("recall_at_10") double recallAt10,
            @JsonProperty("mrr") double meanReciprocalRank) {

        static MetricSummary of(List<QueryEvaluation> evaluations) {
            if (evaluations.isEmpty()) {
                return new MetricSummary(0, 0.0d, 0.0d, 0.0d);
            }
            double recallAt5 = 0.0d;
            double recallAt10 = 0.0d;
            double reciprocalRanks = 0.0d;
            for (QueryEvaluation evaluation : evaluations) {
                recallAt5 += evaluation.recallAt5();
                recallAt10 += evaluation.recallAt10();
                reciprocalRanks += evaluation.reciprocalRank();
            }
            int count = evaluations.size();
            return new MetricSummary(count, recallAt5 / count, recallAt10 / count, reciprocalRanks / count);
        }
    }
}
