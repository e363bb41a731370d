package ch.so.arp.hybrid.retrieval;

import java.util.concurrent.atomic.LongAdder;

import org.springframework.stereotype.Component;

/**
 * Counters for retrieval traffic and, above all, for the degraded paths that
 * silently discard filters.
 */
@Component
public class RetrievalMetrics {

    private final LongAdder queries = new LongAdder();
    private final LongAdder emptyResults = new LongAdder();
    private final LongAdder denseFilterDropped = new LongAdder();
    private final LongAdder sparseFilterDropped = new LongAdder();
    private final LongAdder unfilteredRetries = new LongAdder();
    private final LongAdder vectorPortFailures = new LongAdder();

    void recordQuery(SearchOutcome outcome) {
        queries.increment();
        if (outcome.results().isEmpty()) {
            emptyResults.increment();
        }
    }

    void recordFallback(FallbackStage stage) {
        switch (stage) {
            case DENSE_FILTER_DROPPED:
                denseFilterDropped.increment();
                break;
            case SPARSE_FILTER_DROPPED:
                sparseFilterDropped.increment();
                break;
            case UNFILTERED_RETRY:
                unfilteredRetries.increment();
                break;
            default:
                throw new IllegalStateException("Unhandled fallback stage " + stage);
        }
    }

    void recordVectorPortFailure() {
        vectorPortFailures.increment();
    }

    public Snapshot snapshot() {
        return new Snapshot(queries.sum(), emptyResults.sum(), denseFilterDropped.sum(), sparseFilterDropped.sum(),
                unfilteredRetries.sum(), vectorPortFailures.sum());
    }

    public record Snapshot(
            long queries,
            long emptyResults,
            long denseFilterDropped,
            long sparseFilterDropped,
            long unfilteredRetries,
            long vectorPortFailures) {
    }
}
