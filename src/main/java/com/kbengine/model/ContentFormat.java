package com.kbengine.model;

import java.util.Locale;
import java.util.Map;

public enum ContentFormat {
    MARKDOWN("text/markdown"),
    JSON("application/json"),
    YAML("application/yaml"),
    RST("text/x-rst"),
    PLAINTEXT("text/plain");

    private static final Map<String, ContentFormat> EXTENSIONS = Map.ofEntries(
        Map.entry("md", MARKDOWN),
        Map.entry("markdown", MARKDOWN),
        Map.entry("mdx", MARKDOWN),
        Map.entry("json", JSON),
        Map.entry("yaml", YAML),
        Map.entry("yml", YAML),
        Map.entry("rst", RST),
        Map.entry("txt", PLAINTEXT),
        Map.entry("text", PLAINTEXT)
    );

    private final String mimeType;

    ContentFormat(String mimeType) {
        this.mimeType = mimeType;
    }

    public String mimeType() {
        return mimeType;
    }

    public static ContentFormat fromPath(String path) {
        if (path == null) {
            return PLAINTEXT;
        }
        int dot = path.lastIndexOf('.');
        if (dot < 0 || dot == path.length() - 1) {
            return PLAINTEXT;
        }
        String extension = path.substring(dot + 1).toLowerCase(Locale.ROOT);
        return EXTENSIONS.getOrDefault(extension, PLAINTEXT);
    }

    public static boolean isSupported(String path) {
        if (path == null) {
            return false;
        }
        int dot = path.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.containsKey(path.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
