package ch.so.arp.hybrid.retrieval;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Search request carrying the flat filters of a natural language filter
 * extractor, e.g. {@code {"region": "EU", "deprecated": false}}.
 */
public record ExtractedFilterSearchRequest(
        @NotBlank String query,
        @JsonProperty("top_k") @Positive Integer topK,
        Map<String, Object> filters) {
}
