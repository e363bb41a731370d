package ch.so.arp.hybrid.retrieval;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of the corpus: the articles in load order, a lookup by id
 * and the BM25 index built over them. A rebuild creates a new instance.
 */
public final class CorpusIndex {

    private final List<Article> articles;
    private final Map<String, Article> articlesById;
    private final SparseIndex sparseIndex;

    private CorpusIndex(List<Article> articles, Map<String, Article> articlesById, SparseIndex sparseIndex) {
        this.articles = articles;
        this.articlesById = articlesById;
        this.sparseIndex = sparseIndex;
    }

    /**
     * Builds a snapshot over the given articles.
     *
     * @throws IllegalArgumentException if two articles share a {@code doc_id}
     */
    public static CorpusIndex build(List<Article> articles) {
        List<Article> copy = List.copyOf(articles);
        Map<String, Article> byId = new HashMap<>();
        for (Article article : copy) {
            if (byId.putIfAbsent(article.docId(), article) != null) {
                throw new IllegalArgumentException("Duplicate doc_id in corpus: " + article.docId());
            }
        }
        return new CorpusIndex(copy, Map.copyOf(byId), new SparseIndex(copy));
    }

    public List<Article> articles() {
        return articles;
    }

    public Optional<Article> article(String docId) {
        return Optional.ofNullable(articlesById.get(docId));
    }

    /**
     * Resolves the article for a hit, falling back to an empty placeholder for
     * ids unknown to this snapshot.
     */
    Article resolve(String docId) {
        Article article = articlesById.get(docId);
        return article != null ? article : Article.unresolved(docId);
    }

    public SparseIndex sparseIndex() {
        return sparseIndex;
    }

    public int size() {
        return articles.size();
    }
}
