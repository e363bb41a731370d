package ch.so.arp.hybrid.retrieval;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * PostgreSQL/pgvector backed {@link VectorSearchPort}. Articles live in the
 * {@code kb_articles} table with their metadata columns and an
 * {@code embedding vector} column maintained by the ingestion pipeline.
 * Filters are pushed down into the {@code WHERE} clause.
 */
class PgVectorSearchPort implements VectorSearchPort {

    private static final Logger LOGGER = LoggerFactory.getLogger(PgVectorSearchPort.class);

    private static final String SEMANTIC_SQL = """
            SELECT
              doc_id,
              (1.0 - (embedding <=> :embedding::vector)) AS similarity
            FROM kb_articles
            WHERE embedding IS NOT NULL%s
            ORDER BY embedding <=> :embedding::vector, doc_id
            LIMIT :limit
            """;

    private final JdbcClient jdbcClient;
    private final EmbeddingProvider embeddingProvider;

    PgVectorSearchPort(JdbcClient jdbcClient, EmbeddingProvider embeddingProvider) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
    }

    @Override
    public List<RankedItem> query(CorpusIndex snapshot, String queryText, int topK, FilterPredicate filter) {
        if (topK <= 0) {
            return List.of();
        }
        String where = "";
        JdbcClient.StatementSpec statement;
        if (filter != null) {
            PgVectorFilterTranslator.SqlFilter sqlFilter = PgVectorFilterTranslator.translate(filter);
            where = "\n  AND " + sqlFilter.clause();
            statement = jdbcClient.sql(SEMANTIC_SQL.formatted(where)).params(sqlFilter.params());
        } else {
            statement = jdbcClient.sql(SEMANTIC_SQL.formatted(where));
        }

        List<SimilarityRow> rows = statement
                .param("embedding", toPgVectorLiteral(embeddingProvider.embed(queryText)))
                .param("limit", topK)
                .query(SimilarityRowMapper.INSTANCE)
                .list();

        List<RankedItem> hits = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            hits.add(new RankedItem(rows.get(i).docId(), rows.get(i).similarity(), i + 1));
        }
        LOGGER.debug("pgvector search returned {} hits (limit={}, filtered={})", hits.size(), topK, filter != null);
        return hits;
    }

    static String toPgVectorLiteral(float[] embedding) {
        StringJoiner literal = new StringJoiner(",", "[", "]");
        for (float component : embedding) {
            literal.add(String.format(Locale.ROOT, "%f", component));
        }
        return literal.toString();
    }

    private enum SimilarityRowMapper implements RowMapper<SimilarityRow> {
        INSTANCE;

        @Override
        public SimilarityRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new SimilarityRow(rs.getString("doc_id"), rs.getDouble("similarity"));
        }
    }

    private record SimilarityRow(String docId, double similarity) {
    }
}
