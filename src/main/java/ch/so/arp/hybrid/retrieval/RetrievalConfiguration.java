package ch.so.arp.hybrid.retrieval;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * Central configuration wiring the retrieval components together. The
 * {@code rag.retrieval.mock-vector-store} toggle decides whether the
 * in-process vector store or PostgreSQL/pgvector backs the dense branch.
 */
@Configuration
@EnableConfigurationProperties(RetrievalProperties.class)
public class RetrievalConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public ExecutorService retrievalExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    @ConditionalOnMissingBean
    public CorpusIndexHolder corpusIndexHolder() {
        return new CorpusIndexHolder();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingProvider embeddingProvider(RetrievalProperties properties) {
        return new HashingEmbeddingProvider(properties.getEmbeddingDimensions());
    }

    @Bean
    @ConditionalOnProperty(name = "rag.retrieval.mock-vector-store", havingValue = "true", matchIfMissing = true)
    public VectorSearchPort inMemoryVectorSearchPort(EmbeddingProvider embeddingProvider) {
        return new InMemoryVectorSearchPort(embeddingProvider);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.retrieval.mock-vector-store", havingValue = "false")
    public VectorSearchPort pgVectorSearchPort(JdbcClient jdbcClient, EmbeddingProvider embeddingProvider) {
        return new PgVectorSearchPort(jdbcClient, embeddingProvider);
    }
}
