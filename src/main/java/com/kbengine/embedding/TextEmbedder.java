package com.kbengine.embedding;

import java.util.List;

public interface TextEmbedder {

    float[] embedQuery(String query);

    /**
     * One vector per input text, in input order.
     */
    List<float[]> embedAll(List<String> texts);
}
