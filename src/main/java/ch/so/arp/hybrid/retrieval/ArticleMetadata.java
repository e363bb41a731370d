package ch.so.arp.hybrid.retrieval;

import java.util.List;

/**
 * Structured metadata of a knowledge base article. Any component may be
 * {@code null} when the source record did not carry it; the filter evaluator
 * treats such fields as absent.
 */
public record ArticleMetadata(
        String region,
        String productVersion,
        String category,
        Boolean deprecated,
        String effectiveDate,
        List<String> errorCodes) {

    public ArticleMetadata {
        errorCodes = errorCodes == null ? List.of() : List.copyOf(errorCodes);
    }

    public static ArticleMetadata empty() {
        return new ArticleMetadata(null, null, null, null, null, List.of());
    }

    /**
     * Error codes collapsed into the comma joined form used for membership
     * checks, e.g. {@code "E-4012,E-5001"}.
     */
    public String errorCodesJoined() {
        return String.join(",", errorCodes);
    }

    /**
     * Flattened view of a single field as seen by filter predicates.
     *
     * @return the field value or {@code null} when absent
     */
    public Object valueOf(FilterField field) {
        switch (field) {
            case REGION:
                return region;
            case PRODUCT_VERSION:
                return productVersion;
            case CATEGORY:
                return category;
            case DEPRECATED:
                return deprecated;
            case EFFECTIVE_DATE:
                return effectiveDate;
            case ERROR_CODES:
                return errorCodesJoined();
            default:
                throw new IllegalStateException("Unhandled filter field " + field);
        }
    }
}
