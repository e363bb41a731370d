package ch.so.arp.hybrid.retrieval;

public enum SearchMode {
    HYBRID,
    DENSE,
    SPARSE
}
