package ch.so.arp.hybrid.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process replacement for the external vector store. It embeds the articles
 * of the snapshot handed in by the caller, ranks them by cosine similarity and
 * applies filters with the {@link FilterEvaluator}, so it needs neither a
 * database nor an embedding service. Hits therefore always belong to the
 * snapshot the query resolves them against, even while a rebuild swaps in a
 * new index.
 */
class InMemoryVectorSearchPort implements VectorSearchPort {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryVectorSearchPort.class);

    private final EmbeddingProvider embeddingProvider;
    private final AtomicReference<EmbeddedCorpus> embedded = new AtomicReference<>();

    InMemoryVectorSearchPort(EmbeddingProvider embeddingProvider) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
    }

    @Override
    public List<RankedItem> query(CorpusIndex snapshot, String queryText, int topK, FilterPredicate filter) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (topK <= 0) {
            return List.of();
        }
        EmbeddedCorpus corpus = embeddingsFor(snapshot);
        float[] queryVector = embeddingProvider.embed(queryText);

        List<Candidate> candidates = new ArrayList<>();
        List<Article> articles = corpus.index().articles();
        for (int i = 0; i < articles.size(); i++) {
            Article article = articles.get(i);
            if (filter != null && !FilterEvaluator.matches(filter, article.metadata())) {
                continue;
            }
            candidates.add(new Candidate(article.docId(), cosine(queryVector, corpus.vectors()[i])));
        }
        candidates.sort(Comparator.comparingDouble(Candidate::similarity).reversed());

        int limit = Math.min(topK, candidates.size());
        List<RankedItem> hits = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            Candidate candidate = candidates.get(i);
            hits.add(new RankedItem(candidate.docId(), candidate.similarity(), i + 1));
        }
        return hits;
    }

    private EmbeddedCorpus embeddingsFor(CorpusIndex index) {
        EmbeddedCorpus cached = embedded.get();
        if (cached != null && cached.index() == index) {
            return cached;
        }
        List<Article> articles = index.articles();
        float[][] vectors = new float[articles.size()][];
        for (int i = 0; i < articles.size(); i++) {
            vectors[i] = embeddingProvider.embed(articles.get(i).searchableText());
        }
        EmbeddedCorpus fresh = new EmbeddedCorpus(index, vectors);
        embedded.set(fresh);
        LOGGER.info("Embedded {} articles for in-memory vector search", articles.size());
        return fresh;
    }

    private static double cosine(float[] left, float[] right) {
        double dot = 0.0d;
        double leftNorm = 0.0d;
        double rightNorm = 0.0d;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0d || rightNorm == 0.0d) {
            return 0.0d;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private record EmbeddedCorpus(CorpusIndex index, float[][] vectors) {
    }

    private record Candidate(String docId, double similarity) {
    }
}
