package ch.so.arp.hybrid.retrieval;

/**
 * Raised when a query arrives before any corpus index has been built.
 */
public class IndexUnavailableException extends RetrievalException {

    public IndexUnavailableException(String message) {
        super(message);
    }
}
