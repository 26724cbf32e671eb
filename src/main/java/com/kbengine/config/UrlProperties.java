package com.kbengine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Map;

/**
 * Per-repository URL templates. Placeholders: {remote}, {commit}, {path}.
 */
@ConfigurationProperties(prefix = "app.url")
public record UrlProperties(Map<String, String> templates) {

    public UrlProperties {
        templates = templates == null ? Map.of() : Map.copyOf(templates);
    }
}
