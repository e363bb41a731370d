package ch.so.arp.hybrid.retrieval;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Coordinates the dense branch (external vector store, filter applied
 * natively), the sparse branch (local BM25, filter applied afterwards),
 * reciprocal rank fusion and the fallbacks taken when a filter leaves nothing
 * to return.
 *
 * <p>Fallback policy for a filtered hybrid query:
 * <ol>
 * <li>a failing vector store call is retried once without the filter, a
 * second failure aborts the query;</li>
 * <li>if post-filtering removes every BM25 candidate, the unfiltered BM25
 * ranking is used for the sparse branch;</li>
 * <li>if fusion yields nothing, the whole query is run once more without the
 * filter.</li>
 * </ol>
 * Every fallback is logged, counted in {@link RetrievalMetrics} and reported
 * in {@link SearchOutcome#fallbacks()}.
 */
@Service
public class HybridRetrievalService {

    private static final Logger LOGGER = LoggerFactory.getLogger(HybridRetrievalService.class);

    private final CorpusIndexHolder indexHolder;
    private final VectorSearchPort vectorSearchPort;
    private final Executor retrievalExecutor;
    private final RetrievalProperties properties;
    private final RetrievalMetrics metrics;

    public HybridRetrievalService(CorpusIndexHolder indexHolder, VectorSearchPort vectorSearchPort,
            Executor retrievalExecutor, RetrievalProperties properties, RetrievalMetrics metrics) {
        this.indexHolder = Objects.requireNonNull(indexHolder, "indexHolder");
        this.vectorSearchPort = Objects.requireNonNull(vectorSearchPort, "vectorSearchPort");
        this.retrievalExecutor = Objects.requireNonNull(retrievalExecutor, "retrievalExecutor");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public SearchOutcome search(String query, int topK, FilterPredicate filter) {
        return search(SearchMode.HYBRID, query, topK, filter);
    }

    /**
     * Run a query in the given mode.
     *
     * @param mode   which branches to use
     * @param query  the natural language query
     * @param topK   number of results, must be positive
     * @param filter metadata predicate, or {@code null}
     * @return at most {@code topK} results ranked 1..n
     * @throws IndexUnavailableException   if no corpus index has been built
     * @throws VectorPortFailureException  if the vector store fails beyond the
     *                                     single retry
     */
    public SearchOutcome search(SearchMode mode, String query, int topK, FilterPredicate filter) {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(query, "query");
        if (topK <= 0) {
            throw new IllegalArgumentException("topK must be positive but was " + topK);
        }
        CorpusIndex index = indexHolder.current();
        SearchOutcome outcome;
        switch (mode) {
            case DENSE:
                outcome = dense(index, query, topK, filter);
                break;
            case SPARSE:
                outcome = sparse(index, query, topK, filter);
                break;
            default:
                outcome = hybrid(index, query, topK, filter, true);
                break;
        }
        metrics.recordQuery(outcome);
        return outcome;
    }

    private SearchOutcome hybrid(CorpusIndex index, String query, int topK, FilterPredicate filter,
            boolean unfilteredRetryAllowed) {
        int candidates = candidateCount(topK, properties.getOverFetchMultiplier());
        BranchResult dense = denseBranch(index, query, candidates, filter);
        BranchResult sparse = sparseBranch(index, query, candidates,
                candidateCount(topK, properties.getFilteredSparseMultiplier()), filter);

        List<ReciprocalRankFusion.Fused<RankedArticle>> fused = ReciprocalRankFusion
                .fuse(List.of(dense.hits(), sparse.hits()), properties.getRrfK());
        LOGGER.debug("Hybrid query '{}': dense={} ({}), sparse={} ({}), fused={}", query, dense.hits().size(),
                dense.status(), sparse.hits().size(), sparse.status(), fused.size());

        if (fused.isEmpty() && filter != null && unfilteredRetryAllowed) {
            LOGGER.warn("Hybrid query '{}' with filter {} returned no results; retrying without filter", query, filter);
            metrics.recordFallback(FallbackStage.UNFILTERED_RETRY);
            SearchOutcome retry = hybrid(index, query, topK, null, false);
            EnumSet<FallbackStage> fallbacks = EnumSet.of(FallbackStage.UNFILTERED_RETRY);
            fallbacks.addAll(retry.fallbacks());
            return new SearchOutcome(SearchMode.HYBRID, retry.results(), fallbacks);
        }

        List<SearchResult> results = fused.stream()
                .limit(topK)
                .map(hit -> SearchResult.of(hit.source().article(), hit.score(), hit.rank()))
                .toList();
        return new SearchOutcome(SearchMode.HYBRID, results, fallbacksOf(dense, sparse));
    }

    private SearchOutcome dense(CorpusIndex index, String query, int topK, FilterPredicate filter) {
        BranchResult dense = denseBranch(index, query, topK, filter);
        return new SearchOutcome(SearchMode.DENSE, toResults(dense.hits(), topK), fallbacksOf(dense));
    }

    private SearchOutcome sparse(CorpusIndex index, String query, int topK, FilterPredicate filter) {
        BranchResult sparse = sparseBranch(index, query, topK,
                candidateCount(topK, properties.getFilteredSparseMultiplier()), filter);
        return new SearchOutcome(SearchMode.SPARSE, toResults(sparse.hits(), topK), fallbacksOf(sparse));
    }

    private BranchResult denseBranch(CorpusIndex index, String query, int size, FilterPredicate filter) {
        if (filter == null) {
            return new BranchResult(resolve(index, queryVectorStore(index, query, size, null)),
                    BranchStatus.UNFILTERED, FallbackStage.DENSE_FILTER_DROPPED);
        }
        try {
            return new BranchResult(resolve(index, queryVectorStore(index, query, size, filter)),
                    BranchStatus.FILTERED, FallbackStage.DENSE_FILTER_DROPPED);
        } catch (VectorPortFailureException ex) {
            LOGGER.warn("Filtered vector search for '{}' failed ({}); retrying without filter {}", query,
                    ex.getMessage(), filter);
            metrics.recordFallback(FallbackStage.DENSE_FILTER_DROPPED);
            return new BranchResult(resolve(index, queryVectorStore(index, query, size, null)),
                    BranchStatus.FILTER_DROPPED, FallbackStage.DENSE_FILTER_DROPPED);
        }
    }

    private BranchResult sparseBranch(CorpusIndex index, String query, int size, int filteredFetchSize,
            FilterPredicate filter) {
        SparseIndex sparseIndex = index.sparseIndex();
        if (filter == null) {
            return new BranchResult(resolve(index, sparseIndex.search(query, size)), BranchStatus.UNFILTERED,
                    FallbackStage.SPARSE_FILTER_DROPPED);
        }
        List<RankedArticle> survivors = new ArrayList<>();
        for (RankedItem hit : sparseIndex.search(query, filteredFetchSize)) {
            Article article = index.resolve(hit.docId());
            if (FilterEvaluator.matches(filter, article.metadata())) {
                survivors.add(new RankedArticle(article, hit.score(), hit.rank()));
            }
        }
        if (!survivors.isEmpty()) {
            List<RankedArticle> reranked = RankedArticle.rerank(survivors);
            return new BranchResult(reranked.subList(0, Math.min(size, reranked.size())), BranchStatus.FILTERED,
                    FallbackStage.SPARSE_FILTER_DROPPED);
        }
        LOGGER.warn("BM25 post-filter {} removed all candidates for '{}'; using unfiltered BM25", filter, query);
        metrics.recordFallback(FallbackStage.SPARSE_FILTER_DROPPED);
        return new BranchResult(resolve(index, sparseIndex.search(query, size)), BranchStatus.FILTER_DROPPED,
                FallbackStage.SPARSE_FILTER_DROPPED);
    }

    private List<RankedItem> queryVectorStore(CorpusIndex index, String query, int size, FilterPredicate filter) {
        CompletableFuture<List<RankedItem>> future = CompletableFuture
                .supplyAsync(() -> vectorSearchPort.query(index, query, size, filter), retrievalExecutor);
        long timeoutMs = properties.getVectorTimeout().toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            metrics.recordVectorPortFailure();
            throw new VectorPortFailureException("Vector search timed out after " + timeoutMs + "ms", ex);
        } catch (ExecutionException ex) {
            metrics.recordVectorPortFailure();
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new VectorPortFailureException("Vector search failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            metrics.recordVectorPortFailure();
            throw new VectorPortFailureException("Interrupted while waiting for vector search", ex);
        }
    }

    // saturates instead of overflowing for very large topK
    private static int candidateCount(int topK, int multiplier) {
        return (int) Math.min(Integer.MAX_VALUE, (long) topK * multiplier);
    }

    private static List<RankedArticle> resolve(CorpusIndex index, List<RankedItem> hits) {
        List<RankedArticle> resolved = new ArrayList<>(hits.size());
        for (RankedItem hit : hits) {
            resolved.add(new RankedArticle(index.resolve(hit.docId()), hit.score(), hit.rank()));
        }
        return resolved;
    }

    private static List<SearchResult> toResults(List<RankedArticle> hits, int topK) {
        int limit = Math.min(topK, hits.size());
        List<SearchResult> results = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            RankedArticle hit = hits.get(i);
            results.add(SearchResult.of(hit.article(), hit.score(), i + 1));
        }
        return results;
    }

    private static EnumSet<FallbackStage> fallbacksOf(BranchResult... branches) {
        EnumSet<FallbackStage> fallbacks = EnumSet.noneOf(FallbackStage.class);
        for (BranchResult branch : branches) {
            if (branch.status() == BranchStatus.FILTER_DROPPED) {
                fallbacks.add(branch.droppedStage());
            }
        }
        return fallbacks;
    }

    enum BranchStatus {
        UNFILTERED,
        FILTERED,
        FILTER_DROPPED
    }

    private record BranchResult(List<RankedArticle> hits, BranchStatus status, FallbackStage droppedStage) {
    }
}
