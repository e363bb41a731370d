package ch.so.arp.hybrid.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Incoming payload for search requests. {@code filter} uses the predicate wire
 * format understood by {@link FilterPredicateParser}.
 */
public record SearchRequest(
        @NotBlank String query,
        @JsonProperty("top_k") @Positive Integer topK,
        JsonNode filter,
        SearchMode mode) {
}
