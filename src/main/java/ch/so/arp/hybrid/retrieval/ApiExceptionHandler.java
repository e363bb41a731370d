package ch.so.arp.hybrid.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.validation.ConstraintViolationException;

/**
 * Maps retrieval failures to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(MalformedPredicateException.class)
    public ResponseEntity<ErrorResponse> handleMalformedPredicate(MalformedPredicateException ex) {
        return error(HttpStatus.BAD_REQUEST, "malformed_predicate", ex.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class,
            ConstraintViolationException.class, HttpMessageNotReadableException.class,
            HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request: " + ex.getMessage());
    }

    @ExceptionHandler(IndexUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleIndexUnavailable(IndexUnavailableException ex) {
        LOGGER.error("Query rejected: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "index_unavailable", ex.getMessage());
    }

    @ExceptionHandler(VectorPortFailureException.class)
    public ResponseEntity<ErrorResponse> handleVectorPortFailure(VectorPortFailureException ex) {
        LOGGER.error("Vector search failed: {}", ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, "vector_search_failed", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }
}
