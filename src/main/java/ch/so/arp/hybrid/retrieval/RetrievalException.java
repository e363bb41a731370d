package ch.so.arp.hybrid.retrieval;

/**
 * Base type for failures that abort a retrieval request.
 */
public abstract class RetrievalException extends RuntimeException {

    protected RetrievalException(String message) {
        super(message);
    }

    protected RetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
