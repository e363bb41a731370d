package ch.so.arp.hybrid.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints: corpus index statistics, rebuilds and retrieval
 * counters.
 */
@RestController
public class IndexController {

    private static final Logger LOGGER = LoggerFactory.getLogger(IndexController.class);

    private final CorpusIndexHolder indexHolder;
    private final CorpusBootstrap corpusBootstrap;
    private final RetrievalMetrics metrics;

    public IndexController(CorpusIndexHolder indexHolder, CorpusBootstrap corpusBootstrap, RetrievalMetrics metrics) {
        this.indexHolder = indexHolder;
        this.corpusBootstrap = corpusBootstrap;
        this.metrics = metrics;
    }

    @GetMapping(path = "/api/index", produces = MediaType.APPLICATION_JSON_VALUE)
    public IndexStats stats() {
        return IndexStats.of(indexHolder.current());
    }

    @PostMapping(path = "/api/index/rebuild", produces = MediaType.APPLICATION_JSON_VALUE)
    public IndexStats rebuild() {
        LOGGER.info("Corpus index rebuild requested");
        return IndexStats.of(corpusBootstrap.reload());
    }

    @GetMapping(path = "/api/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    public RetrievalMetrics.Snapshot metrics() {
        return metrics.snapshot();
    }
}
