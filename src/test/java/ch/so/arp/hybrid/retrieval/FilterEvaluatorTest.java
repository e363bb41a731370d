package ch.so.arp.hybrid.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class FilterEvaluatorTest {

    private static final ArticleMetadata EU = new ArticleMetadata("EU", "v2.0", "authentication", false,
            "2024-03-01", List.of("E-4012", "E-4013"));
    private static final ArticleMetadata US = new ArticleMetadata("US", "v1.0", "billing", true, "2022-06-15",
            List.of());
    private static final ArticleMetadata NO_REGION = new ArticleMetadata(null, "v3.0", "networking", null,
            null, List.of());

    @Test
    void matchesEquality() {
        FilterPredicate predicate = FilterPredicate.eq(FilterField.REGION, "EU");

        assertThat(FilterEvaluator.matches(predicate, EU)).isTrue();
        assertThat(FilterEvaluator.matches(predicate, US)).isFalse();
    }

    @Test
    void andRequiresAllChildren() {
        FilterPredicate predicate = FilterPredicate.and(
                FilterPredicate.eq(FilterField.REGION, "EU"),
                FilterPredicate.eq(FilterField.DEPRECATED, false));

        assertThat(FilterEvaluator.matches(predicate, EU)).isTrue();
        assertThat(FilterEvaluator.matches(predicate, US)).isFalse();
        assertThat(FilterEvaluator.matches(predicate,
                new ArticleMetadata("EU", "v2.0", "billing", true, "2024-01-01", List.of()))).isFalse();
    }

    @Test
    void orRequiresAnyChild() {
        FilterPredicate predicate = FilterPredicate.or(
                FilterPredicate.eq(FilterField.CATEGORY, "billing"),
                FilterPredicate.eq(FilterField.PRODUCT_VERSION, "v2.0"));

        assertThat(FilterEvaluator.matches(predicate, EU)).isTrue();
        assertThat(FilterEvaluator.matches(predicate, US)).isTrue();
        assertThat(FilterEvaluator.matches(predicate, NO_REGION)).isFalse();
    }

    @Test
    void comparesDatesAndVersionsByNaturalOrder() {
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.EFFECTIVE_DATE, FilterOperator.GTE, "2024-01-01"), EU)).isTrue();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.EFFECTIVE_DATE, FilterOperator.GT, "2024-03-01"), EU)).isFalse();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.EFFECTIVE_DATE, FilterOperator.LT, "2023-01-01"), US)).isTrue();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.PRODUCT_VERSION, FilterOperator.LTE, "v2.0"), EU)).isTrue();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.PRODUCT_VERSION, FilterOperator.LTE, "v2.0"), NO_REGION)).isFalse();
    }

    @Test
    void evaluatesSetMembership() {
        FilterPredicate in = FilterPredicate.of(FilterField.REGION, FilterOperator.IN, List.of("EU", "APAC"));
        FilterPredicate nin = FilterPredicate.of(FilterField.REGION, FilterOperator.NIN, List.of("EU", "APAC"));

        assertThat(FilterEvaluator.matches(in, EU)).isTrue();
        assertThat(FilterEvaluator.matches(in, US)).isFalse();
        assertThat(FilterEvaluator.matches(nin, EU)).isFalse();
        assertThat(FilterEvaluator.matches(nin, US)).isTrue();
    }

    @Test
    void absentFieldsOnlyPassNegativeOperators() {
        assertThat(FilterEvaluator.matches(FilterPredicate.eq(FilterField.REGION, "EU"), NO_REGION)).isFalse();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.REGION, FilterOperator.GT, "A"), NO_REGION)).isFalse();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.REGION, FilterOperator.IN, List.of("EU")), NO_REGION)).isFalse();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.REGION, FilterOperator.NE, "EU"), NO_REGION)).isTrue();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.DEPRECATED, FilterOperator.NIN, List.of(true)), NO_REGION)).isTrue();
    }

    @Test
    void checksErrorCodesInJoinedField() {
        FilterPredicate contains = FilterPredicate.of(FilterField.ERROR_CODES, FilterOperator.CONTAINS, "E-4013");
        FilterPredicate equals = FilterPredicate.eq(FilterField.ERROR_CODES, "E-4012,E-4013");

        assertThat(FilterEvaluator.matches(contains, EU)).isTrue();
        assertThat(FilterEvaluator.matches(contains, US)).isFalse();
        assertThat(FilterEvaluator.matches(equals, EU)).isTrue();
    }

    @Test
    void comparesBooleansWithoutCoercion() {
        assertThat(FilterEvaluator.matches(FilterPredicate.eq(FilterField.DEPRECATED, true), US)).isTrue();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.DEPRECATED, FilterOperator.NE, true), EU)).isTrue();
    }

    @Test
    void ordersBooleansFalseBeforeTrue() {
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.DEPRECATED, FilterOperator.GT, false), US)).isTrue();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.DEPRECATED, FilterOperator.GT, false), EU)).isFalse();
        assertThat(FilterEvaluator.matches(
                FilterPredicate.of(FilterField.DEPRECATED, FilterOperator.LTE, false), EU)).isTrue();
    }
}
