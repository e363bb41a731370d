package ch.so.arp.hybrid.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Display ready search hit.
 */
public record SearchResult(
        @JsonProperty("doc_id") String docId,
        @JsonProperty("title") String title,
        @JsonProperty("body") String body,
        @JsonProperty("region") String region,
        @JsonProperty("product_version") String productVersion,
        @JsonProperty("category") String category,
        @JsonProperty("deprecated") Boolean deprecated,
        @JsonProperty("score") double score,
        @JsonProperty("rank") int rank) {

    static SearchResult of(Article article, double score, int rank) {
        ArticleMetadata metadata = article.metadata();
        return new SearchResult(article.docId(), article.title(), article.body(), metadata.region(),
                metadata.productVersion(), metadata.category(), metadata.deprecated(), score, rank);
    }
}
