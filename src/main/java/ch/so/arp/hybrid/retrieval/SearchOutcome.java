package ch.so.arp.hybrid.retrieval;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Results of one query together with the fallback stages it went through.
 * An empty result list with no fallbacks is a legitimate "nothing found".
 */
public record SearchOutcome(SearchMode mode, List<SearchResult> results, Set<FallbackStage> fallbacks) {

    public SearchOutcome {
        results = List.copyOf(results);
        EnumSet<FallbackStage> stages = EnumSet.noneOf(FallbackStage.class);
        stages.addAll(fallbacks);
        fallbacks = Collections.unmodifiableSet(stages);
    }

    public boolean isDegraded() {
        return !fallbacks.isEmpty();
    }
}
