package com.kbengine.model;

public enum DocumentStatus {
    PENDING,
    PROCESSING,
    INDEXED,
    FAILED
}
