package ch.so.arp.hybrid.retrieval;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Boolean expression over article metadata. A predicate is either a single
 * {@link Condition} or an {@link And}/{@link Or} composite of child predicates.
 * Instances are immutable and validated on construction, so an evaluator never
 * sees an unknown field, an unknown operator or a mistyped operand.
 */
public sealed interface FilterPredicate permits FilterPredicate.Condition, FilterPredicate.And, FilterPredicate.Or {

    static Condition eq(FilterField field, Object value) {
        return new Condition(field, FilterOperator.EQ, value);
    }

    static Condition of(FilterField field, FilterOperator operator, Object value) {
        return new Condition(field, operator, value);
    }

    static And and(FilterPredicate... children) {
        return new And(List.of(children));
    }

    static Or or(FilterPredicate... children) {
        return new Or(List.of(children));
    }

    /**
     * Leaf comparing one metadata field against an operand. For {@code $in}
     * and {@code $nin} the operand is a list of values.
     */
    record Condition(FilterField field, FilterOperator operator, Object value) implements FilterPredicate {

        public Condition {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(operator, "operator");
            if (operator.isSetOperator()) {
                if (!(value instanceof List<?> values)) {
                    throw new MalformedPredicateException(
                            "Operator " + operator.wireName() + " on '" + field.key() + "' requires a list operand");
                }
                values.forEach(item -> checkOperand(field, operator, item));
                value = List.copyOf(values);
            } else {
                checkOperand(field, operator, value);
            }
            if (operator == FilterOperator.CONTAINS && field.valueType() != String.class) {
                throw new MalformedPredicateException("Operator $contains is not supported on '" + field.key() + "'");
            }
        }

        private static void checkOperand(FilterField field, FilterOperator operator, Object operand) {
            if (operand == null || !field.valueType().isInstance(operand)) {
                throw new MalformedPredicateException("Operator " + operator.wireName() + " on '" + field.key()
                        + "' expects a " + field.valueType().getSimpleName().toLowerCase(Locale.ROOT) + " operand but got "
                        + (operand == null ? "null" : operand.getClass().getSimpleName().toLowerCase(Locale.ROOT)));
            }
        }
    }

    record And(List<FilterPredicate> children) implements FilterPredicate {

        public And {
            children = requireChildren("$and", children);
        }
    }

    record Or(List<FilterPredicate> children) implements FilterPredicate {

        public Or {
            children = requireChildren("$or", children);
        }
    }

    private static List<FilterPredicate> requireChildren(String name, List<FilterPredicate> children) {
        if (children == null || children.isEmpty()) {
            throw new MalformedPredicateException(name + " requires at least one condition");
        }
        return List.copyOf(children);
    }
}
