package ch.so.arp.hybrid.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import com.fasterxml.jackson.databind.ObjectMapper;

class CorpusLoaderTest {

    private final CorpusLoader loader = new CorpusLoader(new DefaultResourceLoader(), new ObjectMapper());

    @Test
    void readsFlatArticleRecords() {
        List<Article> articles = loader.load("classpath:data/test_articles.json");

        assertThat(articles).extracting(Article::docId).containsExactly("KB-0001", "KB-0002", "KB-0003", "KB-0004");
        Article legacy = articles.get(1);
        assertThat(legacy.metadata().region()).isEqualTo("US");
        assertThat(legacy.metadata().productVersion()).isEqualTo("v1.0");
        assertThat(legacy.metadata().deprecated()).isTrue();
        assertThat(legacy.metadata().errorCodes()).containsExactly("E-4012", "E-4013");
        assertThat(legacy.metadata().errorCodesJoined()).isEqualTo("E-4012,E-4013");
    }

    @Test
    void failsForMissingResource() {
        assertThatThrownBy(() -> loader.load("classpath:data/missing.json"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("missing.json");
    }

    @Test
    void bootstrapBuildsIndexFromConfiguredLocation() {
        RetrievalProperties properties = new RetrievalProperties();
        properties.getCorpus().setLocation("classpath:data/test_articles.json");
        CorpusIndexHolder holder = new CorpusIndexHolder();
        CorpusBootstrap bootstrap = new CorpusBootstrap(loader, holder, properties);

        bootstrap.run(null);

        assertThat(holder.current().size()).isEqualTo(4);
        assertThat(holder.current().article("KB-0003")).isPresent();
    }

    @Test
    void bootstrapSkipsLoadingWhenDisabled() {
        RetrievalProperties properties = new RetrievalProperties();
        properties.getCorpus().setLoadOnStartup(false);
        CorpusIndexHolder holder = new CorpusIndexHolder();

        new CorpusBootstrap(loader, holder, properties).run(null);

        assertThat(holder.isAvailable()).isFalse();
    }
}
