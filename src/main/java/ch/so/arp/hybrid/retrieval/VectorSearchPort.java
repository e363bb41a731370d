package ch.so.arp.hybrid.retrieval;

import java.util.List;

/**
 * Semantic search delegated to an external vector store. Implementations must
 * enforce the filter predicate natively with the same semantics as
 * {@link FilterEvaluator}.
 */
public interface VectorSearchPort {

    /**
     * Find the documents most similar to the query text.
     *
     * @param snapshot  corpus snapshot the calling query runs against; stores
     *                  that keep their own copy of the articles ignore it
     * @param queryText the natural language query
     * @param topK      the maximum number of hits
     * @param filter    predicate every hit must satisfy, or {@code null}
     * @return hits ordered by descending similarity with ranks 1..n, possibly
     *         fewer than {@code topK}
     * @throws RuntimeException on any failure of the underlying store
     */
    List<RankedItem> query(CorpusIndex snapshot, String queryText, int topK, FilterPredicate filter);
}
