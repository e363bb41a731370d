package ch.so.arp.hybrid.retrieval;

import java.util.Objects;

/**
 * Bare ranked hit as returned by the sparse index and the vector search port.
 */
public record RankedItem(String docId, double score, int rank) implements Ranked {

    public RankedItem {
        Objects.requireNonNull(docId, "docId");
        if (rank < 1) {
            throw new IllegalArgumentException("rank must be >= 1 but was " + rank);
        }
    }
}
