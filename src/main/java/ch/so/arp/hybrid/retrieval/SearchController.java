package ch.so.arp.hybrid.retrieval;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * REST endpoint exposing hybrid, dense and sparse search.
 */
@RestController
@RequestMapping(path = "/api/search", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class SearchController {

    private final HybridRetrievalService retrievalService;
    private final RetrievalProperties properties;

    public SearchController(HybridRetrievalService retrievalService, RetrievalProperties properties) {
        this.retrievalService = retrievalService;
        this.properties = properties;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public SearchResponse search(@Valid @RequestBody SearchRequest request) {
        FilterPredicate filter = FilterPredicateParser.parse(request.filter()).orElse(null);
        SearchMode mode = request.mode() == null ? SearchMode.HYBRID : request.mode();
        return SearchResponse.of(retrievalService.search(mode, request.query(), topK(request.topK()), filter));
    }

    @PostMapping(path = "/extracted", consumes = MediaType.APPLICATION_JSON_VALUE)
    public SearchResponse searchWithExtractedFilters(@Valid @RequestBody ExtractedFilterSearchRequest request) {
        FilterPredicate filter = FilterPredicateParser.fromExtractedFilters(request.filters()).orElse(null);
        return SearchResponse.of(retrievalService.search(request.query(), topK(request.topK()), filter));
    }

    private int topK(Integer requested) {
        return requested == null ? properties.getDefaultTopK() : requested;
    }
}
