package com.kbengine.config;

import com.kbengine.exception.ConfigurationException;
import com.kbengine.extraction.DocumentKindDetector;
import com.kbengine.extraction.DocumentNodeExtractor;
import com.kbengine.extraction.EntityDocumentParser;
import com.kbengine.extraction.EntityGraphExtractor;
import com.kbengine.extraction.ExtractionStrategy;
import com.kbengine.extraction.GraphWriteLock;
import com.kbengine.extraction.KindAwareExtractionStrategy;
import com.kbengine.graph.GraphStore;
import com.kbengine.graph.JdbcGraphStore;
import com.kbengine.graph.Neo4jGraphStore;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.GraphDatabase;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;

import java.util.List;
import java.util.Locale;

/**
 * Builds the graph store chosen by {@code app.graph.backend} and the extraction strategy that writes to it.
 * With {@code none} neither bean exists and indexation and search run without a graph.
 */
@Slf4j
@Configuration
@ConditionalOnExpression("'${app.graph.backend:jdbc}' != 'none'")
public class GraphConfig {

    @Bean
    public GraphStore graphStore(GraphProperties properties, JdbcClient jdbcClient) {
        String backend = properties.backend() == null ? "jdbc" : properties.backend().trim().toLowerCase(Locale.ROOT);
        switch (backend) {
            case "jdbc":
                log.info("Graph backend: jdbc");
                return new JdbcGraphStore(jdbcClient);
            case "neo4j":
                GraphProperties.Neo4j neo4j = properties.neo4j();
                if (neo4j == null || neo4j.uri() == null) {
                    throw new ConfigurationException("app.graph.neo4j.uri is required for the neo4j backend");
                }
                log.info("Graph backend: neo4j at {}", neo4j.uri());
                return new Neo4jGraphStore(GraphDatabase.driver(neo4j.uri(),
                    AuthTokens.basic(neo4j.username(), neo4j.password())));
            default:
                throw new ConfigurationException("Unknown graph backend: " + properties.backend()
                    + " (expected jdbc, neo4j or none)");
        }
    }

    @Bean
    public GraphWriteLock graphWriteLock() {
        return new GraphWriteLock();
    }

    @Bean
    public ExtractionStrategy extractionStrategy(GraphStore graphStore, DocumentKindDetector detector,
                                                 EntityDocumentParser parser, GraphWriteLock graphWriteLock) {
        return new KindAwareExtractionStrategy(
            graphStore,
            detector,
            List.of(new EntityGraphExtractor(graphStore, parser)),
            new DocumentNodeExtractor(graphStore),
            graphWriteLock
        );
    }
}
