package com.kbengine.embedding;

import com.kbengine.config.EmbeddingProperties;
import com.kbengine.exception.EmbeddingException;
import com.kbengine.exception.ValidationException;
import com.kbengine.infra.RateLimiter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class LangChainTextEmbedder implements TextEmbedder {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;
    private final EmbeddingProperties properties;

    public LangChainTextEmbedder(
        EmbeddingModel embeddingModel,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        EmbeddingProperties properties
    ) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
        this.properties = properties;
    }

    @Override
    @Retryable(retryFor = EmbeddingException.class, maxAttempts = 3, backoff = @Backoff(delay = 500, multiplier = 2))
    public float[] embedQuery(String inputQuery) {
        if (inputQuery == null || inputQuery.isBlank()) {
            throw new ValidationException("Query cannot be empty");
        }

        String query = inputQuery.trim();
        if (query.length() > properties.maxQueryLength()) {
            query = query.substring(0, properties.maxQueryLength());
            log.warn("Query was truncated to {} characters for embedding", properties.maxQueryLength());
        }

        log.debug("Generating embedding for query: '{}'", query);

        String text = query;
        try {
            float[] vector = embeddingLimiter.execute(EMBEDDING_LIMIT, estimateTokens(text),
                () -> embeddingModel.embed(text).content().vector());
            return checkDimensions(vector);
        } catch (EmbeddingException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to generate embedding for query: {}", query, e);
            throw new EmbeddingException("Error during query vectorization", e);
        }
    }

    @Override
    @Retryable(retryFor = EmbeddingException.class, maxAttempts = 3, backoff = @Backoff(delay = 1000, multiplier = 2))
    public List<float[]> embedAll(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        int estimatedTokens = texts.stream().mapToInt(LangChainTextEmbedder::estimateTokens).sum();
        try {
            Response<List<Embedding>> response = embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens,
                () -> embeddingModel.embedAll(texts.stream().map(TextSegment::from).toList()));

            List<Embedding> embeddings = response.content();
            if (embeddings == null || embeddings.size() != texts.size()) {
                throw new EmbeddingException("Embedding model returned " + (embeddings == null ? 0 : embeddings.size())
                    + " vectors for " + texts.size() + " texts");
            }
            return embeddings.stream().map(e -> checkDimensions(e.vector())).toList();
        } catch (EmbeddingException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to embed batch of {} texts: {}", texts.size(), e.getMessage());
            throw new EmbeddingException("Error during batch vectorization", e);
        }
    }

    private float[] checkDimensions(float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding model returned an empty vector");
        }
        if (vector.length != properties.dimensions()) {
            throw new EmbeddingException("Embedding model returned " + vector.length
                + " dimensions, expected " + properties.dimensions());
        }
        return vector;
    }

    private static int estimateTokens(String text) {
        return Math.max(1, text.length() / 4);
    }
}
