package com.kbengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Graph backend selection. {@code backend} is one of {@code jdbc}, {@code neo4j} or {@code none}.
 */
@Validated
@ConfigurationProperties(prefix = "app.graph")
public record GraphProperties(
    String backend,
    Neo4j neo4j
) {

    public record Neo4j(String uri, String username, String password) {}
}
