package com.kbengine.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kbengine.indexing.RepositoryConfig;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record RepositoryRequest(
    @NotBlank
    String name,

    @NotBlank
    @JsonProperty("local_path")
    String localPath,

    @JsonProperty("remote_url")
    String remoteUrl,

    String branch,

    @JsonProperty("include_patterns")
    List<String> includePatterns,

    @JsonProperty("exclude_patterns")
    List<String> excludePatterns,

    String since
) {

    public RepositoryConfig toConfig() {
        return new RepositoryConfig(name, localPath, remoteUrl, branch, includePatterns, excludePatterns);
    }
}
