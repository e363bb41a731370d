package ch.so.arp.hybrid.retrieval;

import java.util.List;
import java.util.Objects;

/**
 * Evaluates {@link FilterPredicate}s against the metadata of one article. This
 * is the local counterpart of the filtering the vector store applies natively
 * and must agree with it, including for absent fields: a missing value fails
 * every comparison except {@code $ne} and {@code $nin}.
 */
public final class FilterEvaluator {

    private FilterEvaluator() {
    }

    public static boolean matches(FilterPredicate predicate, ArticleMetadata metadata) {
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(metadata, "metadata");
        if (predicate instanceof FilterPredicate.And and) {
            return and.children().stream().allMatch(child -> matches(child, metadata));
        }
        if (predicate instanceof FilterPredicate.Or or) {
            return or.children().stream().anyMatch(child -> matches(child, metadata));
        }
        FilterPredicate.Condition condition = (FilterPredicate.Condition) predicate;
        return test(condition, metadata.valueOf(condition.field()));
    }

    private static boolean test(FilterPredicate.Condition condition, Object actual) {
        if (actual == null) {
            return condition.operator().acceptsAbsent();
        }
        Object operand = condition.value();
        switch (condition.operator()) {
            case EQ:
                return actual.equals(operand);
            case NE:
                return !actual.equals(operand);
            case GT:
                return compare(actual, operand) > 0;
            case GTE:
                return compare(actual, operand) >= 0;
            case LT:
                return compare(actual, operand) < 0;
            case LTE:
                return compare(actual, operand) <= 0;
            case IN:
                return ((List<?>) operand).contains(actual);
            case NIN:
                return !((List<?>) operand).contains(actual);
            case CONTAINS:
                return ((String) actual).contains((String) operand);
            default:
                throw new IllegalStateException("Unhandled operator " + condition.operator());
        }
    }

    // ISO-8601 dates and the vX.Y versions order correctly as plain strings
    private static int compare(Object actual, Object operand) {
        if (actual instanceof String text && operand instanceof String other) {
            return text.compareTo(other);
        }
        if (actual instanceof Boolean flag && operand instanceof Boolean other) {
            return flag.compareTo(other);
        }
        throw new MalformedPredicateException("Cannot compare " + actual.getClass().getSimpleName() + " with "
                + operand.getClass().getSimpleName());
    }
}
