package com.kbengine.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.kbengine.model.ContentFormat;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

public record DocumentRequest(
    @NotBlank
    String title,

    @NotBlank
    String content,

    ContentFormat format,

    String domain,

    List<String> tags,

    @JsonProperty("external_id")
    String externalId
) {}
