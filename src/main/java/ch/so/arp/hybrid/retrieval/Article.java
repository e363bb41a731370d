package ch.so.arp.hybrid.retrieval;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable knowledge base article as loaded from the corpus file.
 */
public record Article(String docId, String title, String body, ArticleMetadata metadata) {

    public Article {
        Objects.requireNonNull(docId, "docId");
        title = title == null ? "" : title;
        body = body == null ? "" : body;
        metadata = metadata == null ? ArticleMetadata.empty() : metadata;
    }

    /**
     * Creates an article from the flat corpus record layout.
     */
    @JsonCreator
    public static Article fromRecord(
            @JsonProperty("doc_id") String docId,
            @JsonProperty("title") String title,
            @JsonProperty("body") String body,
            @JsonProperty("region") String region,
            @JsonProperty("product_version") String productVersion,
            @JsonProperty("category") String category,
            @JsonProperty("deprecated") Boolean deprecated,
            @JsonProperty("effective_date") String effectiveDate,
            @JsonProperty("error_codes") List<String> errorCodes) {
        return new Article(docId, title, body,
                new ArticleMetadata(region, productVersion, category, deprecated, effectiveDate, errorCodes));
    }

    /**
     * Placeholder for a document the vector service knows but the local corpus
     * does not. Display fields stay empty.
     */
    public static Article unresolved(String docId) {
        return new Article(docId, "", "", ArticleMetadata.empty());
    }

    /**
     * Text that is indexed for lexical and semantic retrieval.
     */
    public String searchableText() {
        return title + " " + body;
    }
}
