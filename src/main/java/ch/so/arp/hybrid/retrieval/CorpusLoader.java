package ch.so.arp.hybrid.retrieval;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the article corpus, a JSON array of flat article records, from a
 * Spring resource location.
 */
@Component
public class CorpusLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusLoader.class);

    private static final TypeReference<List<Article>> ARTICLE_LIST = new TypeReference<>() {
    };

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public CorpusLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    public List<Article> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Corpus resource not found: " + location);
        }
        try (InputStream input = resource.getInputStream()) {
            List<Article> articles = objectMapper.readValue(input, ARTICLE_LIST);
            LOGGER.info("Loaded {} articles from {}", articles.size(), location);
            return articles;
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read corpus from " + location, ex);
        }
    }
}
