package ch.so.arp.hybrid.retrieval;

import java.util.List;
import java.util.Set;

public record SearchResponse(SearchMode mode, List<SearchResult> results, Set<FallbackStage> fallbacks) {

    static SearchResponse of(SearchOutcome outcome) {
        return new SearchResponse(outcome.mode(), outcome.results(), outcome.fallbacks());
    }
}
