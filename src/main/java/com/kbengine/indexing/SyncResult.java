package com.kbengine.indexing;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SyncResult(
    int indexed,

    int deleted,

    int skipped,

    @JsonProperty("current_revision")
    String currentRevision,

    List<ItemError> errors
) {}
