package ch.so.arp.hybrid.retrieval;

/**
 * Raised when a filter predicate names an unknown field or operator, carries a
 * value of the wrong type or is otherwise not a valid predicate tree.
 */
public class MalformedPredicateException extends RetrievalException {

    public MalformedPredicateException(String message) {
        super(message);
    }
}
