package com.kbengine.controller;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record GraphQueryRequest(
    @NotBlank
    String query,

    Map<String, Object> parameters
) {}
