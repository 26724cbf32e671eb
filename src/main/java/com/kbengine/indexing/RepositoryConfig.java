package com.kbengine.indexing;

import lombok.Builder;

import java.util.List;

/**
 * A git working tree to index. {@code name} prefixes every external id, so it must stay stable across runs.
 */
@Builder(toBuilder = true)
public record RepositoryConfig(
    String name,
    String localPath,
    String remoteUrl,
    String branch,
    List<String> includePatterns,
    List<String> excludePatterns
) {

    public static final List<String> DEFAULT_INCLUDES = List.of("**/*.md");

    public RepositoryConfig {
        branch = branch == null ? "main" : branch;
        includePatterns = includePatterns == null || includePatterns.isEmpty()
            ? DEFAULT_INCLUDES : List.copyOf(includePatterns);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    public String externalId(String relativePath) {
        return name + ":" + relativePath;
    }
}
