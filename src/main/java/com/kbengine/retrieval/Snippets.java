package com.kbengine.retrieval;

final class Snippets {

    private Snippets() {
    }

    /**
     * Whitespace-collapsed prefix of {@code content}, cut at a word boundary when one is close enough.
     */
    static String of(String content, int maxLength) {
        if (content == null) {
            return "";
        }
        String flat = content.replaceAll("\\s+", " ").trim();
        if (flat.length() <= maxLength) {
            return flat;
        }
        int cut = flat.lastIndexOf(' ', maxLength);
        if (cut < maxLength / 2) {
            cut = maxLength;
        }
        return flat.substring(0, cut).trim() + "...";
    }
}
