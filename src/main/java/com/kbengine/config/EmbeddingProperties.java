package com.kbengine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.embedding")
public record EmbeddingProperties(
    @NotBlank String modelName,
    @NotNull @Min(1) Integer dimensions,
    @NotNull @Min(1) Integer rpmLimit,
    @NotNull @Min(1) Integer tpmLimit,
    @NotNull @Min(1) Integer maxQueryLength
) {}
