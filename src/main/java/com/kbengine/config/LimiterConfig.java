package com.kbengine.config;

import com.kbengine.infra.InMemoryDualRateLimiter;
import com.kbengine.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(EmbeddingProperties properties) {
        return new InMemoryDualRateLimiter(properties.rpmLimit(), properties.tpmLimit());
    }
}
