package ch.so.arp.hybrid.retrieval;

/**
 * Degraded paths a query may take when a filter cannot be honoured. None of
 * them is an error; they are reported so callers and operators can see that a
 * filter was discarded.
 */
public enum FallbackStage {

    /**
     * The vector store failed with the filter applied and answered the
     * unfiltered retry.
     */
    DENSE_FILTER_DROPPED,

    /**
     * Post-filtering removed every BM25 candidate, so the unfiltered BM25
     * ranking was used.
     */
    SPARSE_FILTER_DROPPED,

    /**
     * The filtered query fused to nothing and the whole query was re-run
     * without the filter.
     */
    UNFILTERED_RETRY
}
