package com.kbengine.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.search")
public record SearchProperties(
    @NotNull @Min(1) @Max(100) Integer limit,
    @Min(0) @Max(1) Double threshold,
    @NotNull @Min(20) Integer snippetLength,
    @NotNull @Min(1) Integer graphCandidatesFactor,
    @NotNull @Min(0) Integer relationshipsPerNode,
    @NotNull @Min(1) Integer rrfK,
    @NotNull @Min(1) Integer titleFallbackLimit
) {

    public static SearchProperties defaults() {
        return new SearchProperties(10, 0.5, 200, 2, 5, 60, 1);
    }
}
