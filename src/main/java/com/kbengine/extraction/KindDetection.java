package com.kbengine.extraction;

public record KindDetection(DocumentKind kind, double confidence, String detectedFrom) {

    public static KindDetection unknown() {
        return new KindDetection(DocumentKind.UNKNOWN, 0.0, "none");
    }
}
