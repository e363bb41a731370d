package ch.so.arp.hybrid.retrieval;

/**
 * Element of a ranked candidate list produced by one retrieval branch.
 */
public interface Ranked {

    String docId();

    double score();

    /**
     * One based position within the producing list.
     */
    int rank();
}
