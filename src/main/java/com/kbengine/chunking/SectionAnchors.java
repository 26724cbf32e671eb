package com.kbengine.chunking;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;

/**
 * GitHub-style heading slugs.
 */
public final class SectionAnchors {

    private SectionAnchors() {
    }

    /**
     * Slug of the deepest heading, or null for text outside any heading.
     */
    public static String fromHeadingPath(List<String> headingPath) {
        if (headingPath == null || headingPath.isEmpty()) {
            return null;
        }
        String slug = slugify(headingPath.get(headingPath.size() - 1));
        return slug.isEmpty() ? null : slug;
    }

    public static String slugify(String heading) {
        if (heading == null) {
            return "";
        }
        String normalized = Normalizer.normalize(heading.strip(), Normalizer.Form.NFKC).toLowerCase(Locale.ROOT);
        StringBuilder slug = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                slug.append(c);
            } else if (c == ' ') {
                slug.append('-');
            }
        }
        return slug.toString();
    }
}
