package com.kbengine.controller;

import java.util.Map;

public record ErrorResponse(
    String message,
    int status,
    long timestamp,
    Map<String, Object> details
) {

    public ErrorResponse(String message, int status, long timestamp) {
        this(message, status, timestamp, null);
    }
}
