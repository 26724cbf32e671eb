package com.kbengine.chunking;

import java.util.List;

/**
 * A run of text under one heading. {@code headingPath} lists the enclosing headings, outermost first.
 */
public record Section(List<String> headingPath, String content) {

    public Section {
        headingPath = headingPath == null ? List.of() : List.copyOf(headingPath);
        content = content == null ? "" : content;
    }

    public String heading() {
        return headingPath.isEmpty() ? null : headingPath.get(headingPath.size() - 1);
    }
}
