package ch.so.arp.hybrid.retrieval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory Okapi BM25 index over a fixed list of articles. The index is built
 * once in the constructor and never mutated afterwards, so a single instance
 * can serve concurrent queries.
 *
 * <p>Inverse document frequency follows the Okapi variant
 * {@code ln((N - df + 0.5) / (df + 0.5))}. Terms whose idf would be negative
 * (present in more than half of the corpus) are floored to
 * {@code EPSILON * averageIdf}.
 */
public final class SparseIndex {

    static final double K1 = 1.5d;
    static final double B = 0.75d;
    static final double EPSILON = 0.25d;

    private final List<String> docIds;
    private final List<Map<String, Integer>> termFrequencies;
    private final int[] documentLengths;
    private final Map<String, Integer> documentFrequencies;
    private final Map<String, Double> idf;
    private final double averageDocumentLength;

    public SparseIndex(List<Article> articles) {
        int size = articles.size();
        List<String> ids = new ArrayList<>(size);
        List<Map<String, Integer>> frequencies = new ArrayList<>(size);
        Map<String, Integer> df = new HashMap<>();
        this.documentLengths = new int[size];
        long totalLength = 0L;

        for (int i = 0; i < size; i++) {
            Article article = articles.get(i);
            List<String> tokens = Tokenizer.tokenize(article.searchableText());
            Map<String, Integer> tf = new HashMap<>();
            for (String token : tokens) {
                tf.merge(token, 1, Integer::sum);
            }
            for (String term : tf.keySet()) {
                df.merge(term, 1, Integer::sum);
            }
            ids.add(article.docId());
            frequencies.add(Collections.unmodifiableMap(tf));
            documentLengths[i] = tokens.size();
            totalLength += tokens.size();
        }

        this.docIds = List.copyOf(ids);
        this.termFrequencies = List.copyOf(frequencies);
        this.documentFrequencies = Collections.unmodifiableMap(df);
        this.averageDocumentLength = size == 0 ? 0.0d : (double) totalLength / size;
        this.idf = Collections.unmodifiableMap(computeIdf(df, size));
    }

    private static Map<String, Double> computeIdf(Map<String, Integer> df, int corpusSize) {
        Map<String, Double> values = new HashMap<>();
        List<String> negative = new ArrayList<>();
        double sum = 0.0d;
        for (Map.Entry<String, Integer> entry : df.entrySet()) {
            int freq = entry.getValue();
            double value = Math.log(corpusSize - freq + 0.5d) - Math.log(freq + 0.5d);
            values.put(entry.getKey(), value);
            sum += value;
            if (value < 0.0d) {
                negative.add(entry.getKey());
            }
        }
        if (!values.isEmpty()) {
            double floor = EPSILON * (sum / values.size());
            for (String term : negative) {
                values.put(term, floor);
            }
        }
        return values;
    }

    /**
     * Ranks the whole corpus against the query and returns the best
     * {@code topK} entries. Documents scoring zero are still returned; equal
     * scores keep corpus insertion order.
     *
     * @param query free text query
     * @param topK  maximum number of hits, larger values return the whole corpus
     * @return hits with contiguous ranks starting at 1
     */
    public List<RankedItem> search(String query, int topK) {
        if (topK <= 0 || docIds.isEmpty()) {
            return List.of();
        }
        double[] scores = scores(Tokenizer.tokenize(query));

        List<Integer> order = new ArrayList<>(docIds.size());
        for (int i = 0; i < docIds.size(); i++) {
            order.add(i);
        }
        // List.sort is stable, so equal scores stay in insertion order
        order.sort(Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        int limit = Math.min(topK, order.size());
        List<RankedItem> hits = new ArrayList<>(limit);
        for (int position = 0; position < limit; position++) {
            int doc = order.get(position);
            hits.add(new RankedItem(docIds.get(doc), scores[doc], position + 1));
        }
        return hits;
    }

    double[] scores(List<String> queryTokens) {
        double[] scores = new double[docIds.size()];
        for (String term : queryTokens) {
            Double termIdf = idf.get(term);
            if (termIdf == null) {
                continue;
            }
            for (int doc = 0; doc < scores.length; doc++) {
                Integer tf = termFrequencies.get(doc).get(term);
                if (tf == null) {
                    continue;
                }
                double lengthNorm = 1.0d - B + B * documentLengths[doc] / averageDocumentLength;
                scores[doc] += termIdf * (tf * (K1 + 1.0d)) / (tf + K1 * lengthNorm);
            }
        }
        return scores;
    }

    public int documentCount() {
        return docIds.size();
    }

    public int vocabularySize() {
        return documentFrequencies.size();
    }

    public double averageDocumentLength() {
        return averageDocumentLength;
    }

    public int documentFrequency(String term) {
        return documentFrequencies.getOrDefault(term, 0);
    }

    public double idf(String term) {
        return idf.getOrDefault(term, 0.0d);
    }
}
