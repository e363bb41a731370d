package ch.so.arp.hybrid.retrieval;

/**
 * Failure or timeout of the external vector search.
 */
public class VectorPortFailureException extends RetrievalException {

    public VectorPortFailureException(String message) {
        super(message);
    }

    public VectorPortFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
