package com.kbengine.chunking;

import com.kbengine.model.ChunkType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

@Component
@Order(2)
public class UseCaseChunkingStrategy extends KeywordChunkingStrategy {

    public UseCaseChunkingStrategy() {
        super(ChunkType.USE_CASE,
            Set.of("use-case", "usecase", "caso-de-uso"),
            Set.of("use case", "caso de uso", "main flow", "flujo principal", "preconditions", "precondiciones"));
    }

    @Override
    protected boolean matchesContent(String content) {
        String lower = content.toLowerCase(Locale.ROOT);
        return (lower.contains("actor:") || lower.contains("**actor**"))
            && (lower.contains("flow") || lower.contains("flujo"));
    }
}
