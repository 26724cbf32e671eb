package com.kbengine.indexing;

public record ItemError(String path, String message) {}
