package com.kbengine.chunking;

import com.kbengine.model.ContentFormat;

import java.util.List;

public interface ContentParser {

    ContentFormat format();

    /**
     * Splits raw content into heading-scoped sections, in document order. Blank sections are dropped.
     */
    List<Section> parse(String content);
}
