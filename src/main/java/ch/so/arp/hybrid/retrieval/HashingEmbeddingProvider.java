package ch.so.arp.hybrid.retrieval;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic embedding provider based on signed feature hashing of the
 * tokenizer output. Texts sharing vocabulary end up close to each other, which
 * is enough for the in-process vector store to behave like a semantic search
 * without contacting an embedding service.
 */
class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(HashingEmbeddingProvider.class);

    private final int size;

    HashingEmbeddingProvider(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Embedding size must be positive but was " + size);
        }
        this.size = size;
        LOGGER.info("Using hashing embeddings with {} dimensions", size);
    }

    @Override
    public float[] embed(String text) {
        MessageDigest sha256 = newDigest();
        float[] counts = new float[size];
        for (String token : Tokenizer.tokenize(text)) {
            ByteBuffer hash = ByteBuffer.wrap(sha256.digest(token.getBytes(StandardCharsets.UTF_8)));
            int slot = (int) Long.remainderUnsigned(hash.getLong(0), size);
            // ninth byte picks the sign
            counts[slot] += (hash.get(8) & 1) == 0 ? 1.0f : -1.0f;
        }
        return normalize(counts);
    }

    @Override
    public int dimensions() {
        return size;
    }

    private static float[] normalize(float[] counts) {
        double squares = 0.0d;
        for (float count : counts) {
            squares += count * count;
        }
        if (squares == 0.0d) {
            return counts;
        }
        double length = Math.sqrt(squares);
        float[] unit = new float[counts.length];
        for (int slot = 0; slot < counts.length; slot++) {
            unit[slot] = (float) (counts[slot] / length);
        }
        return unit;
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("JVM does not provide SHA-256", ex);
        }
    }
}
