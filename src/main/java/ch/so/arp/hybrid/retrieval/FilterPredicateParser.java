package ch.so.arp.hybrid.retrieval;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Turns the JSON wire format of filter predicates into {@link FilterPredicate}
 * trees. Accepted shapes:
 *
 * <pre>
 * {"region": "EU"}                                  equality shorthand
 * {"region": {"$ne": "EU"}}                         operator condition
 * {"$and": [ ... ]} / {"OR": [ ... ]}               composites
 * </pre>
 *
 * Unknown fields, unknown operators and mistyped operands are rejected with a
 * {@link MalformedPredicateException}; they are never ignored.
 */
public final class FilterPredicateParser {

    private FilterPredicateParser() {
    }

    /**
     * @param node predicate JSON, may be {@code null}
     * @return the predicate, or empty for {@code null}, JSON null and {@code {}}
     */
    public static Optional<FilterPredicate> parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isObject() && node.size() == 0) {
            return Optional.empty();
        }
        return Optional.of(parseNode(node));
    }

    private static FilterPredicate parseNode(JsonNode node) {
        if (!node.isObject()) {
            throw new MalformedPredicateException("Filter predicate must be a JSON object but was " + node.getNodeType());
        }
        if (node.size() == 0) {
            throw new MalformedPredicateException("Empty filter predicate inside a composite");
        }
        List<FilterPredicate> conditions = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = entry.getKey();
            String composite = compositeName(key);
            if (composite != null) {
                if (node.size() != 1) {
                    throw new MalformedPredicateException("'" + key + "' must be the only key of its object");
                }
                List<FilterPredicate> children = parseChildren(key, entry.getValue());
                return "and".equals(composite) ? new FilterPredicate.And(children) : new FilterPredicate.Or(children);
            }
            conditions.addAll(parseField(key, entry.getValue()));
        }
        return conditions.size() == 1 ? conditions.get(0) : new FilterPredicate.And(conditions);
    }

    private static String compositeName(String key) {
        String normalized = key.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("$")) {
            normalized = normalized.substring(1);
        }
        return "and".equals(normalized) || "or".equals(normalized) ? normalized : null;
    }

    private static List<FilterPredicate> parseChildren(String key, JsonNode value) {
        if (!value.isArray()) {
            throw new MalformedPredicateException("'" + key + "' expects an array of conditions");
        }
        List<FilterPredicate> children = new ArrayList<>(value.size());
        for (JsonNode child : value) {
            children.add(parseNode(child));
        }
        return children;
    }

    private static List<FilterPredicate> parseField(String key, JsonNode value) {
        FilterField field = FilterField.fromKey(key)
                .orElseThrow(() -> new MalformedPredicateException("Unknown filter field '" + key + "'"));
        if (!value.isObject()) {
            return List.of(FilterPredicate.eq(field, operand(value)));
        }
        if (value.size() == 0) {
            throw new MalformedPredicateException("No operator given for field '" + key + "'");
        }
        List<FilterPredicate> conditions = new ArrayList<>(value.size());
        Iterator<Map.Entry<String, JsonNode>> operators = value.fields();
        while (operators.hasNext()) {
            Map.Entry<String, JsonNode> entry = operators.next();
            FilterOperator operator = FilterOperator.fromWireName(entry.getKey())
                    .orElseThrow(() -> new MalformedPredicateException(
                            "Unknown filter operator '" + entry.getKey() + "' on field '" + key + "'"));
            conditions.add(FilterPredicate.of(field, operator, operand(entry.getValue())));
        }
        return conditions;
    }

    private static Object operand(JsonNode value) {
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isArray()) {
            List<Object> items = new ArrayList<>(value.size());
            for (JsonNode item : value) {
                Object operand = operand(item);
                if (operand == null || operand instanceof List) {
                    throw new MalformedPredicateException("Set operands must be scalar values");
                }
                items.add(operand);
            }
            return items;
        }
        return null;
    }

    /**
     * Converts the flat filter map produced by a natural language filter
     * extractor ({@code region}, {@code product_version}, {@code category},
     * {@code deprecated}, {@code error_codes}) into a predicate. Every present
     * field becomes an equality condition; an error code becomes a
     * {@code $contains} test on the joined error code field.
     *
     * @return the conjunction of all conditions, or empty for an empty map
     */
    public static Optional<FilterPredicate> fromExtractedFilters(Map<String, ?> filters) {
        if (filters == null || filters.isEmpty()) {
            return Optional.empty();
        }
        List<FilterPredicate> conditions = new ArrayList<>();
        for (Map.Entry<String, ?> entry : filters.entrySet()) {
            FilterField field = FilterField.fromKey(entry.getKey())
                    .orElseThrow(() -> new MalformedPredicateException("Unknown filter field '" + entry.getKey() + "'"));
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (field == FilterField.ERROR_CODES) {
                conditions.add(FilterPredicate.of(field, FilterOperator.CONTAINS, value));
            } else {
                conditions.add(FilterPredicate.eq(field, value));
            }
        }
        if (conditions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(conditions.size() == 1 ? conditions.get(0) : new FilterPredicate.And(conditions));
    }
}
