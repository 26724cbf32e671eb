package com.kbengine.repository;

import com.kbengine.exception.EntityNotFoundException;
import com.kbengine.exception.StoreUnavailableException;
import com.kbengine.infra.JsonColumns;
import com.kbengine.model.Chunk;
import com.kbengine.model.ChunkType;
import com.kbengine.model.ContentFormat;
import com.kbengine.model.Document;
import com.kbengine.model.DocumentStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcDocumentStore implements DocumentStore {

    private final JdbcClient jdbcClient;

    private final RowMapper<Document> documentRowMapper = (rs, rowNum) -> new Document(
        rs.getObject("id", UUID.class),
        rs.getString("title"),
        rs.getString("content"),
        rs.getString("content_hash"),
        DocumentStatus.valueOf(rs.getString("status")),
        ContentFormat.valueOf(rs.getString("format")),
        rs.getString("source_path"),
        rs.getString("relative_path"),
        rs.getString("external_id"),
        rs.getString("repo_name"),
        rs.getString("domain"),
        JsonColumns.readList(rs.getString("tags")),
        JsonColumns.readMap(rs.getString("metadata")),
        rs.getString("mime_type"),
        rs.getString("git_commit"),
        rs.getString("git_remote_url"),
        rs.getString("error_message"),
        rs.getObject("created_at", OffsetDateTime.class),
        rs.getObject("updated_at", OffsetDateTime.class),
        rs.getObject("indexed_at", OffsetDateTime.class)
    );

    private final RowMapper<Chunk> chunkRowMapper = (rs, rowNum) -> new Chunk(
        rs.getObject("id", UUID.class),
        rs.getObject("document_id", UUID.class),
        rs.getInt("sequence"),
        JsonColumns.readList(rs.getString("heading_path")),
        rs.getString("section_anchor"),
        rs.getString("content"),
        ChunkType.valueOf(rs.getString("chunk_type")),
        JsonColumns.readMap(rs.getString("metadata"))
    );

    @Override
    public Document save(Document document) {
        return jdbcClient.sql("""
                INSERT INTO documents (id, title, content, content_hash, status, format, source_path, relative_path,
                                       external_id, repo_name, domain, tags, metadata, mime_type, git_commit,
                                       git_remote_url, error_message, indexed_at)
                VALUES (COALESCE(:id, gen_random_uuid()), :title, :content, :contentHash, :status, :format,
                        :sourcePath, :relativePath, :externalId, :repoName, :domain, CAST(:tags AS jsonb),
                        CAST(:metadata AS jsonb), :mimeType, :gitCommit, :gitRemoteUrl, :errorMessage, :indexedAt)
                ON CONFLICT (id) DO UPDATE SET
                    title = EXCLUDED.title,
                    content = EXCLUDED.content,
                    content_hash = EXCLUDED.content_hash,
                    status = EXCLUDED.status,
                    format = EXCLUDED.format,
                    source_path = EXCLUDED.source_path,
                    relative_path = EXCLUDED.relative_path,
                    external_id = EXCLUDED.external_id,
                    repo_name = EXCLUDED.repo_name,
                    domain = EXCLUDED.domain,
                    tags = EXCLUDED.tags,
                    metadata = EXCLUDED.metadata,
                    mime_type = EXCLUDED.mime_type,
                    git_commit = EXCLUDED.git_commit,
                    git_remote_url = EXCLUDED.git_remote_url,
                    error_message = EXCLUDED.error_message,
                    indexed_at = EXCLUDED.indexed_at,
                    updated_at = NOW()
                RETURNING *
                """)
            .param("id", document.id(), Types.OTHER)
            .param("title", document.title())
            .param("content", document.content())
            .param("contentHash", document.contentHash())
            .param("status", document.status().name())
            .param("format", document.format().name())
            .param("sourcePath", document.sourcePath())
            .param("relativePath", document.relativePath())
            .param("externalId", document.externalId())
            .param("repoName", document.repoName())
            .param("domain", document.domain())
            .param("tags", JsonColumns.write(document.tags()))
            .param("metadata", JsonColumns.write(document.metadata()))
            .param("mimeType", document.mimeType())
            .param("gitCommit", document.gitCommit())
            .param("gitRemoteUrl", document.gitRemoteUrl())
            .param("errorMessage", document.errorMessage())
            .param("indexedAt", document.indexedAt())
            .query(documentRowMapper)
            .single();
    }

    @Override
    public Optional<Document> findById(UUID id) {
        return jdbcClient.sql("SELECT * FROM documents WHERE id = :id")
            .param("id", id)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public Optional<Document> findByExternalId(String externalId) {
        return jdbcClient.sql("SELECT * FROM documents WHERE external_id = :externalId")
            .param("externalId", externalId)
            .query(documentRowMapper)
            .optional();
    }

    @Override
    public List<Document> findByRepository(String repoName) {
        return jdbcClient.sql("SELECT * FROM documents WHERE repo_name = :repoName ORDER BY relative_path")
            .param("repoName", repoName)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public List<Document> findByTitleContaining(String text, int limit) {
        if (text == null || text.isBlank() || limit <= 0) {
            return List.of();
        }
        return jdbcClient.sql("""
                SELECT * FROM documents
                WHERE title ILIKE :pattern ESCAPE '\\'
                ORDER BY length(title) ASC, created_at ASC
                LIMIT :limit
                """)
            .param("pattern", "%" + text.trim().replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%")
            .param("limit", limit)
            .query(documentRowMapper)
            .list();
    }

    @Override
    public void updateStatus(UUID id, DocumentStatus status, String errorMessage) {
        String sql = """
            UPDATE documents
            SET status = :status,
                error_message = :errorMessage,
                indexed_at = CASE WHEN :status = 'INDEXED' THEN NOW() ELSE indexed_at END,
                updated_at = NOW()
            WHERE id = :id
            """;

        int rowsAffected = jdbcClient.sql(sql)
            .param("status", status.name())
            .param("errorMessage", errorMessage)
            .param("id", id)
            .update();

        if (rowsAffected == 0) {
            throw new EntityNotFoundException("Document", id);
        }
    }

    @Override
    public boolean delete(UUID id) {
        return jdbcClient.sql("DELETE FROM documents WHERE id = :id")
            .param("id", id)
            .update() > 0;
    }

    @Override
    @Transactional
    public List<Chunk> saveChunks(UUID documentId, List<Chunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return List.of();
        }

        List<Chunk> saved = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            saved.add(jdbcClient.sql("""
                    INSERT INTO chunks (id, document_id, sequence, heading_path, section_anchor, content, chunk_type, metadata)
                    VALUES (COALESCE(:id, gen_random_uuid()), :documentId, :sequence, CAST(:headingPath AS jsonb),
                            :sectionAnchor, :content, :chunkType, CAST(:metadata AS jsonb))
                    RETURNING *
                    """)
                .param("id", chunk.id(), Types.OTHER)
                .param("documentId", documentId)
                .param("sequence", chunk.sequence())
                .param("headingPath", JsonColumns.write(chunk.headingPath()))
                .param("sectionAnchor", chunk.sectionAnchor())
                .param("content", chunk.content())
                .param("chunkType", chunk.chunkType().name())
                .param("metadata", JsonColumns.write(chunk.metadata()))
                .query(chunkRowMapper)
                .single());
        }
        return saved;
    }

    @Override
    public Optional<Chunk> findChunk(UUID chunkId) {
        return jdbcClient.sql("SELECT * FROM chunks WHERE id = :id")
            .param("id", chunkId)
            .query(chunkRowMapper)
            .optional();
    }

    @Override
    public List<Chunk> findChunks(UUID documentId) {
        return jdbcClient.sql("SELECT * FROM chunks WHERE document_id = :documentId ORDER BY sequence")
            .param("documentId", documentId)
            .query(chunkRowMapper)
            .list();
    }

    @Override
    public int deleteChunks(UUID documentId) {
        return jdbcClient.sql("DELETE FROM chunks WHERE document_id = :documentId")
            .param("documentId", documentId)
            .update();
    }

    @Override
    public void ping() {
        try {
            jdbcClient.sql("SELECT COUNT(*) FROM documents WHERE false").query(Long.class).single();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("documents", e);
        }
    }
}
