package ch.so.arp.hybrid.retrieval;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Translates a {@link FilterPredicate} into a SQL boolean expression over the
 * metadata columns of the vector store table. Operands are always bound as
 * named parameters; column names come from {@link FilterField#key()} only.
 * {@code NULL} columns pass {@code $ne} and {@code $nin} and fail everything
 * else, matching {@link FilterEvaluator}.
 */
final class PgVectorFilterTranslator {

    private PgVectorFilterTranslator() {
    }

    static SqlFilter translate(FilterPredicate predicate) {
        Map<String, Object> params = new LinkedHashMap<>();
        String clause = append(predicate, params);
        return new SqlFilter(clause, params);
    }

    private static String append(FilterPredicate predicate, Map<String, Object> params) {
        if (predicate instanceof FilterPredicate.And and) {
            return join(and.children(), " AND ", params);
        }
        if (predicate instanceof FilterPredicate.Or or) {
            return join(or.children(), " OR ", params);
        }
        FilterPredicate.Condition condition = (FilterPredicate.Condition) predicate;
        String column = condition.field().key();
        String param = "f" + params.size();
        params.put(param, condition.value());
        switch (condition.operator()) {
            case EQ:
                return column + " = :" + param;
            case NE:
                return "(" + column + " IS NULL OR " + column + " <> :" + param + ")";
            case GT:
                return column + " > :" + param;
            case GTE:
                return column + " >= :" + param;
            case LT:
                return column + " < :" + param;
            case LTE:
                return column + " <= :" + param;
            case IN:
                return emptySet(condition) ? "FALSE" : column + " IN (:" + param + ")";
            case NIN:
                return emptySet(condition) ? "TRUE"
                        : "(" + column + " IS NULL OR " + column + " NOT IN (:" + param + "))";
            case CONTAINS:
                return "strpos(" + column + ", :" + param + ") > 0";
            default:
                throw new IllegalStateException("Unhandled operator " + condition.operator());
        }
    }

    private static boolean emptySet(FilterPredicate.Condition condition) {
        return ((List<?>) condition.value()).isEmpty();
    }

    private static String join(List<FilterPredicate> children, String separator, Map<String, Object> params) {
        StringJoiner joiner = new StringJoiner(separator, "(", ")");
        for (FilterPredicate child : children) {
            joiner.add(append(child, params));
        }
        return joiner.toString();
    }

    record SqlFilter(String clause, Map<String, Object> params) {
    }
}
