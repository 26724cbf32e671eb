package com.kbengine.chunking;

import com.kbengine.model.ChunkType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@Order(4)
public class ProcessChunkingStrategy extends KeywordChunkingStrategy {

    private static final Pattern NUMBERED_STEP = Pattern.compile("(?m)^\\s*\\d+[.)]\\s+\\S");
    private static final int MIN_STEPS = 3;

    public ProcessChunkingStrategy() {
        super(ChunkType.PROCESS,
            Set.of("process", "proceso", "procedure", "procedimiento"),
            Set.of("process", "proceso", "procedure", "procedimiento", "steps", "pasos"));
    }

    @Override
    protected boolean matchesContent(String content) {
        Matcher matcher = NUMBERED_STEP.matcher(content);
        int steps = 0;
        while (matcher.find()) {
            if (++steps >= MIN_STEPS) {
                return true;
            }
        }
        return false;
    }
}
