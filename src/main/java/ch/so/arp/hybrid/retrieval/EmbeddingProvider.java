package ch.so.arp.hybrid.retrieval;

/**
 * Turns query and article text into fixed size vectors. The same provider has
 * to embed both sides of a comparison, otherwise similarities are meaningless.
 */
public interface EmbeddingProvider {

    /**
     * @return a vector of {@link #dimensions()} components, all zero for text
     *         without tokens
     */
    float[] embed(String text);

    int dimensions();
}
