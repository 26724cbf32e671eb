package com.kbengine.indexing;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record IndexRepositoryResult(
    String repository,

    String revision,

    @JsonProperty("files_found")
    int filesFound,

    int indexed,

    int failed,

    List<ItemError> errors
) {}
