package ch.so.arp.hybrid.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Builds the corpus index from the configured corpus file when the application
 * starts. Rebuilds later on go through {@link #reload()}.
 */
@Component
public class CorpusBootstrap implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusBootstrap.class);

    private final CorpusLoader corpusLoader;
    private final CorpusIndexHolder indexHolder;
    private final RetrievalProperties properties;

    public CorpusBootstrap(CorpusLoader corpusLoader, CorpusIndexHolder indexHolder, RetrievalProperties properties) {
        this.corpusLoader = corpusLoader;
        this.indexHolder = indexHolder;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCorpus().isLoadOnStartup()) {
            LOGGER.info("Corpus loading on startup is disabled; queries fail until the index is rebuilt");
            return;
        }
        reload();
    }

    /**
     * Loads the configured corpus and swaps in a freshly built index.
     */
    public CorpusIndex reload() {
        return indexHolder.rebuild(corpusLoader.load(properties.getCorpus().getLocation()));
    }
}
