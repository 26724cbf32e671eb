package com.kbengine.repository;

import com.kbengine.exception.StoreUnavailableException;
import com.kbengine.exception.ValidationException;
import com.kbengine.infra.JsonColumns;
import com.kbengine.model.ChunkEmbedding;
import com.kbengine.model.ChunkType;
import com.kbengine.model.ScoredChunk;
import com.kbengine.model.SearchFilters;
import com.pgvector.PGvector;
import lombok.SneakyThrows;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Repository
public class PgVectorIndex implements VectorIndex {

    private final JdbcClient jdbcClient;
    private final JdbcTemplate jdbcTemplate;
    private final int dimensions;

    public PgVectorIndex(
        JdbcClient jdbcClient,
        JdbcTemplate jdbcTemplate,
        @Value("${app.embedding.dimensions:768}") int dimensions
    ) {
        this.jdbcClient = jdbcClient;
        this.jdbcTemplate = jdbcTemplate;
        this.dimensions = dimensions;
    }

    @Override
    public void upsert(List<ChunkEmbedding> embeddings) {
        if (embeddings == null || embeddings.isEmpty()) {
            return;
        }
        for (ChunkEmbedding embedding : embeddings) {
            if (embedding.vector() == null || embedding.vector().length != dimensions) {
                throw new ValidationException("Embedding for chunk " + embedding.chunkId() + " has "
                    + (embedding.vector() == null ? 0 : embedding.vector().length) + " dimensions, expected " + dimensions);
            }
        }

        String sql = """
            INSERT INTO chunk_embeddings (chunk_id, document_id, embedding, metadata)
            VALUES (?, ?, ?, CAST(? AS jsonb))
            ON CONFLICT (chunk_id) DO UPDATE SET
                document_id = EXCLUDED.document_id,
                embedding = EXCLUDED.embedding,
                metadata = EXCLUDED.metadata
            """;

        jdbcTemplate.batchUpdate(sql, new BatchPreparedStatementSetter() {
            @Override
            @SneakyThrows
            public void setValues(PreparedStatement ps, int i) {
                ChunkEmbedding embedding = embeddings.get(i);
                ps.setObject(1, embedding.chunkId());
                ps.setObject(2, embedding.documentId());
                ps.setObject(3, new PGvector(embedding.vector()));
                ps.setString(4, JsonColumns.write(embedding.metadata()));
            }

            @Override
            public int getBatchSize() {
                return embeddings.size();
            }
        });
    }

    @Override
    public List<ScoredChunk> search(float[] queryVector, int limit, SearchFilters filters, Double threshold) {
        PGvector vector = new PGvector(queryVector);
        SearchFilters safeFilters = filters == null ? SearchFilters.NONE : filters;

        List<String> conditions = new ArrayList<>();
        if (threshold != null) {
            conditions.add("1 - (embedding <=> :vector) >= :threshold");
        }
        if (safeFilters.hasDomain()) {
            conditions.add("metadata ->> 'domain' = :domain");
        }
        if (!safeFilters.tags().isEmpty()) {
            conditions.add("EXISTS (SELECT 1 FROM jsonb_array_elements_text(metadata -> 'tags') t WHERE t IN (:tags))");
        }
        if (!safeFilters.chunkTypes().isEmpty()) {
            conditions.add("metadata ->> 'chunk_type' IN (:chunkTypes)");
        }
        if (!safeFilters.documentIds().isEmpty()) {
            conditions.add("document_id IN (:documentIds)");
        }

        // 1 - distance turns cosine distance into a similarity score
        String sql = """
            SELECT chunk_id, document_id, 1 - (embedding <=> :vector) AS score
            FROM chunk_embeddings
            """
            + (conditions.isEmpty() ? "" : "WHERE " + String.join(" AND ", conditions) + "\n")
            + """
            ORDER BY embedding <=> :vector ASC
            LIMIT :limit
            """;

        var statement = jdbcClient.sql(sql)
            .param("vector", vector)
            .param("limit", limit);

        if (threshold != null) {
            statement.param("threshold", threshold);
        }
        if (safeFilters.hasDomain()) {
            statement.param("domain", safeFilters.domain());
        }
        if (!safeFilters.tags().isEmpty()) {
            statement.param("tags", safeFilters.tags());
        }
        if (!safeFilters.chunkTypes().isEmpty()) {
            statement.param("chunkTypes", safeFilters.chunkTypes().stream().map(ChunkType::label).toList());
        }
        if (!safeFilters.documentIds().isEmpty()) {
            statement.param("documentIds", safeFilters.documentIds());
        }

        return statement.query((rs, rowNum) -> new ScoredChunk(
            rs.getObject("chunk_id", UUID.class),
            rs.getObject("document_id", UUID.class),
            rs.getDouble("score")
        )).list();
    }

    @Override
    public int deleteByDocument(UUID documentId) {
        return jdbcClient.sql("DELETE FROM chunk_embeddings WHERE document_id = :documentId")
            .param("documentId", documentId)
            .update();
    }

    @Override
    public void ping() {
        try {
            jdbcClient.sql("SELECT COUNT(*) FROM chunk_embeddings WHERE false").query(Long.class).single();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("vectors", e);
        }
    }
}
