package ch.so.arp.hybrid.retrieval;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One labelled query of the retrieval evaluation set.
 *
 * @param filters flat extracted filters as accepted by
 *                {@link FilterPredicateParser#fromExtractedFilters(Map)}, may
 *                be empty
 */
public record EvalQuery(
        @JsonProperty("query_id") String queryId,
        @JsonProperty("query") String query,
        @JsonProperty("category") String category,
        @JsonProperty("expected_doc_ids") List<String> expectedDocIds,
        @JsonProperty("filters") Map<String, Object> filters) {

    public EvalQuery {
        expectedDocIds = expectedDocIds == null ? List.of() : List.copyOf(expectedDocIds);
        filters = filters == null ? Map.of() : filters;
    }
}
