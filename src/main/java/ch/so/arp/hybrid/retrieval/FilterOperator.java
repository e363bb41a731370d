package ch.so.arp.hybrid.retrieval;

import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators of a filter condition. The wire names follow the
 * {@code $eq} convention of common vector stores; the {@code $} prefix is
 * optional when parsing.
 */
public enum FilterOperator {

    EQ("$eq"),
    NE("$ne"),
    GT("$gt"),
    GTE("$gte"),
    LT("$lt"),
    LTE("$lte"),
    IN("$in"),
    NIN("$nin"),
    CONTAINS("$contains");

    private final String wireName;

    FilterOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Operators whose operand is a list of values.
     */
    public boolean isSetOperator() {
        return this == IN || this == NIN;
    }

    /**
     * Operators that hold for a field missing from the metadata record.
     */
    public boolean acceptsAbsent() {
        return this == NE || this == NIN;
    }

    public static Optional<FilterOperator> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (!normalized.startsWith("$")) {
            normalized = "$" + normalized;
        }
        for (FilterOperator operator : values()) {
            if (operator.wireName.equals(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
