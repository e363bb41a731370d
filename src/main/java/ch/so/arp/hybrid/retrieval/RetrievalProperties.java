package ch.so.arp.hybrid.retrieval;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning knobs of the hybrid retrieval pipeline.
 */
@ConfigurationProperties(prefix = "rag.retrieval")
public class RetrievalProperties {

    /**
     * Number of results returned when a request does not specify one.
     */
    private int defaultTopK = 5;

    /**
     * Smoothing constant of reciprocal rank fusion.
     */
    private int rrfK = ReciprocalRankFusion.DEFAULT_K;

    /**
     * Candidates requested from each branch, as a multiple of the result size.
     */
    private int overFetchMultiplier = 3;

    /**
     * BM25 candidates requested before post-filtering, as a multiple of the
     * result size.
     */
    private int filteredSparseMultiplier = 10;

    /**
     * Maximum time a single vector store call may take.
     */
    private Duration vectorTimeout = Duration.ofSeconds(2);

    /**
     * Use the in-process vector store instead of PostgreSQL/pgvector.
     */
    private boolean mockVectorStore = true;

    /**
     * Dimensions of the hashing embeddings used by the in-process store.
     */
    private int embeddingDimensions = 384;

    private Corpus corpus = new Corpus();

    private Evaluation evaluation = new Evaluation();

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getRrfK() {
        return rrfK;
    }

    public void setRrfK(int rrfK) {
        this.rrfK = rrfK;
    }

    public int getOverFetchMultiplier() {
        return overFetchMultiplier;
    }

    public void setOverFetchMultiplier(int overFetchMultiplier) {
        this.overFetchMultiplier = overFetchMultiplier;
    }

    public int getFilteredSparseMultiplier() {
        return filteredSparseMultiplier;
    }

    public void setFilteredSparseMultiplier(int filteredSparseMultiplier) {
        this.filteredSparseMultiplier = filteredSparseMultiplier;
    }

    public Duration getVectorTimeout() {
        return vectorTimeout;
    }

    public void setVectorTimeout(Duration vectorTimeout) {
        this.vectorTimeout = vectorTimeout;
    }

    public boolean isMockVectorStore() {
        return mockVectorStore;
    }

    public void setMockVectorStore(boolean mockVectorStore) {
        this.mockVectorStore = mockVectorStore;
    }

    public int getEmbeddingDimensions() {
        return embeddingDimensions;
    }

    public void setEmbeddingDimensions(int embeddingDimensions) {
        this.embeddingDimensions = embeddingDimensions;
    }

    public Corpus getCorpus() {
        return corpus;
    }

    public void setCorpus(Corpus corpus) {
        this.corpus = corpus;
    }

    public Evaluation getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(Evaluation evaluation) {
        this.evaluation = evaluation;
    }

    public static class Corpus {

        /**
         * Spring resource location of the corpus JSON file.
         */
        private String location = "classpath:data/kb_articles.json";

        /**
         * Build the corpus index while the application starts.
         */
        private boolean loadOnStartup = true;

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public boolean isLoadOnStartup() {
            return loadOnStartup;
        }

        public void setLoadOnStartup(boolean loadOnStartup) {
            this.loadOnStartup = loadOnStartup;
        }
    }

    public static class Evaluation {

        /**
         * Spring resource location of the labelled evaluation queries.
         */
        private String location = "classpath:evals/eval_set.json";

        /**
         * Results retrieved per evaluation query.
         */
        private int topK = 10;

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }
    }
}
