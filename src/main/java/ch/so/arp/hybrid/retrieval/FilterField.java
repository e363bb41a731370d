package ch.so.arp.hybrid.retrieval;

import java.util.Locale;
import java.util.Optional;

/**
 * Metadata fields a filter predicate may reference. {@code key} is the name on
 * the wire and the column name of the vector store table.
 */
public enum FilterField {

    REGION("region", String.class),
    PRODUCT_VERSION("product_version", String.class),
    CATEGORY("category", String.class),
    DEPRECATED("deprecated", Boolean.class),
    EFFECTIVE_DATE("effective_date", String.class),
    ERROR_CODES("error_codes_str", String.class);

    private final String key;
    private final Class<?> valueType;

    FilterField(String key, Class<?> valueType) {
        this.key = key;
        this.valueType = valueType;
    }

    public String key() {
        return key;
    }

    public Class<?> valueType() {
        return valueType;
    }

    public static Optional<FilterField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        if ("error_codes".equals(normalized)) {
            return Optional.of(ERROR_CODES);
        }
        for (FilterField field : values()) {
            if (field.key.equals(normalized)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
