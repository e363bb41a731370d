package ch.so.arp.hybrid.retrieval;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the corpus index currently used for queries. Readers grab one snapshot
 * per query and keep using it even if a rebuild swaps in a new one meanwhile.
 */
public class CorpusIndexHolder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusIndexHolder.class);

    private final AtomicReference<CorpusIndex> current = new AtomicReference<>();

    /**
     * @return the current snapshot
     * @throws IndexUnavailableException if no index has been built yet
     */
    public CorpusIndex current() {
        CorpusIndex index = current.get();
        if (index == null) {
            throw new IndexUnavailableException("Corpus index has not been built yet");
        }
        return index;
    }

    public boolean isAvailable() {
        return current.get() != null;
    }

    /**
     * Builds a new snapshot from the articles and swaps it in.
     *
     * @return the new snapshot
     */
    public CorpusIndex rebuild(List<Article> articles) {
        long started = System.nanoTime();
        CorpusIndex index = CorpusIndex.build(articles);
        current.set(index);
        LOGGER.info("Built corpus index with {} documents and {} terms in {}ms", index.size(),
                index.sparseIndex().vocabularySize(), (System.nanoTime() - started) / 1_000_000L);
        return index;
    }
}
