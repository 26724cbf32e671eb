package com.kbengine.chunking;

import com.kbengine.model.ChunkType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;

@Component
@Order(1)
public class EntityChunkingStrategy extends KeywordChunkingStrategy {

    public EntityChunkingStrategy() {
        super(ChunkType.ENTITY,
            Set.of("entity", "entidad"),
            Set.of("attributes", "atributos", "relations", "relationships", "relaciones"));
    }
}
