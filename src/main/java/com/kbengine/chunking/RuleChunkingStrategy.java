package com.kbengine.chunking;

import com.kbengine.model.ChunkType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

@Component
@Order(3)
public class RuleChunkingStrategy extends KeywordChunkingStrategy {

    private static final Pattern RULE_ID = Pattern.compile("(?m)^\\s*(?:[-*]\\s*)?\\**(?:RN|BR|RULE)-\\d+");

    public RuleChunkingStrategy() {
        super(ChunkType.RULE,
            Set.of("rule", "business-rule", "regla", "regla-de-negocio"),
            Set.of("rule", "regla", "constraint", "restricci"));
    }

    @Override
    protected boolean matchesContent(String content) {
        return RULE_ID.matcher(content).find();
    }
}
