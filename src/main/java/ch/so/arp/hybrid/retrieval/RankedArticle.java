package ch.so.arp.hybrid.retrieval;

import java.util.ArrayList;
import java.util.List;

/**
 * Ranked hit enriched with the article that carries its display fields.
 */
record RankedArticle(Article article, double score, int rank) implements Ranked {

    @Override
    public String docId() {
        return article.docId();
    }

    /**
     * Assigns contiguous ranks 1..n to the given hits, preserving their order.
     */
    static List<RankedArticle> rerank(List<RankedArticle> hits) {
        List<RankedArticle> reranked = new ArrayList<>(hits.size());
        for (int i = 0; i < hits.size(); i++) {
            RankedArticle hit = hits.get(i);
            reranked.add(new RankedArticle(hit.article(), hit.score(), i + 1));
        }
        return reranked;
    }
}
