package com.kbengine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.chunking")
public record ChunkingProperties(
    @NotNull @Min(100) Integer maxChunkSize,
    @NotNull @Min(0) Integer overlap,
    boolean semantic
) {

    public static ChunkingProperties defaults() {
        return new ChunkingProperties(2000, 200, true);
    }
}
