package ch.so.arp.hybrid.retrieval;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Measures retrieval quality of the hybrid pipeline against a labelled query
 * set. Every query runs through {@link HybridRetrievalService} with its
 * extracted filters; the report carries Recall@5, Recall@10 and the mean
 * reciprocal rank per category and overall.
 */
@Service
public class RetrievalEvaluator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RetrievalEvaluator.class);

    private static final TypeReference<List<EvalQuery>> EVAL_QUERY_LIST = new TypeReference<>() {
    };

    private final HybridRetrievalService retrievalService;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final RetrievalProperties properties;

    public RetrievalEvaluator(HybridRetrievalService retrievalService, ResourceLoader resourceLoader,
            ObjectMapper objectMapper, RetrievalProperties properties) {
        this.retrievalService = retrievalService;
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Fraction of the expected documents found among the first {@code k}
     * retrieved ones. A query without expected documents scores 1.
     */
    public static double recallAtK(List<String> retrievedDocIds, Collection<String> expectedDocIds, int k) {
        if (expectedDocIds.isEmpty()) {
            return 1.0d;
        }
        Set<String> topK = new HashSet<>(retrievedDocIds.subList(0, Math.min(Math.max(k, 0), retrievedDocIds.size())));
        long found = expectedDocIds.stream().filter(topK::contains).count();
        return (double) found / expectedDocIds.size();
    }

    /**
     * {@code 1/rank} of the first expected document in the retrieved list, 0
     * when none was retrieved.
     */
    public static double reciprocalRank(List<String> retrievedDocIds, Collection<String> expectedDocIds) {
        Set<String> expected = new HashSet<>(expectedDocIds);
        for (int i = 0; i < retrievedDocIds.size(); i++) {
            if (expected.contains(retrievedDocIds.get(i))) {
                return 1.0d / (i + 1);
            }
        }
        return 0.0d;
    }

    /**
     * Runs the configured evaluation set.
     */
    public EvaluationReport evaluate() {
        return evaluate(loadEvalSet(properties.getEvaluation().getLocation()));
    }

    public EvaluationReport evaluate(List<EvalQuery> evalQueries) {
        int topK = properties.getEvaluation().getTopK();
        List<EvaluationReport.QueryEvaluation> evaluations = new ArrayList<>(evalQueries.size());
        for (EvalQuery evalQuery : evalQueries) {
            evaluations.add(evaluate(evalQuery, topK));
        }

        Map<String, List<EvaluationReport.QueryEvaluation>> byCategory = new TreeMap<>();
        for (EvaluationReport.QueryEvaluation evaluation : evaluations) {
            byCategory.computeIfAbsent(evaluation.category(), category -> new ArrayList<>()).add(evaluation);
        }
        Map<String, EvaluationReport.MetricSummary> categories = new LinkedHashMap<>();
        byCategory.forEach((category, members) -> {
            EvaluationReport.MetricSummary summary = EvaluationReport.MetricSummary.of(members);
            categories.put(category, summary);
            LOGGER.info("Category {}: {} queries, recall@5={}, recall@10={}, mrr={}", category, summary.queries(),
                    format(summary.recallAt5()), format(summary.recallAt10()), format(summary.meanReciprocalRank()));
        });
        EvaluationReport.MetricSummary overall = EvaluationReport.MetricSummary.of(evaluations);
        LOGGER.info("Evaluated {} queries: recall@5={}, recall@10={}, mrr={}", overall.queries(),
                format(overall.recallAt5()), format(overall.recallAt10()), format(overall.meanReciprocalRank()));
        return new EvaluationReport(List.copyOf(evaluations), categories, overall);
    }

    List<EvalQuery> loadEvalSet(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Evaluation set not found: " + location);
        }
        try (InputStream input = resource.getInputStream()) {
            List<EvalQuery> evalQueries = objectMapper.readValue(input, EVAL_QUERY_LIST);
            LOGGER.info("Loaded {} evaluation queries from {}", evalQueries.size(), location);
            return evalQueries;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read evaluation set from " + location, ex);
        }
    }

    private EvaluationReport.QueryEvaluation evaluate(EvalQuery evalQuery, int topK) {
        FilterPredicate filter = toFilter(evalQuery);
        SearchOutcome outcome = retrievalService.search(evalQuery.query(), topK, filter);
        List<String> retrieved = outcome.results().stream().map(SearchResult::docId).toList();
        List<String> expected = evalQuery.expectedDocIds();
        EvaluationReport.QueryEvaluation evaluation = new EvaluationReport.QueryEvaluation(evalQuery.queryId(),
                evalQuery.query(), evalQuery.category(), expected, retrieved, outcome.fallbacks(),
                recallAtK(retrieved, expected, 5), recallAtK(retrieved, expected, 10),
                reciprocalRank(retrieved, expected));
        LOGGER.debug("{} '{}': retrieved {} expected {}", evalQuery.queryId(), evalQuery.query(), retrieved, expected);
        return evaluation;
    }

    // malformed filters run the query unfiltered
    private static FilterPredicate toFilter(EvalQuery evalQuery) {
        try {
            return FilterPredicateParser.fromExtractedFilters(evalQuery.filters()).orElse(null);
        } catch (MalformedPredicateException ex) {
            LOGGER.warn("Ignoring filters {} of {}: {}", evalQuery.filters(), evalQuery.queryId(), ex.getMessage());
            return null;
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
