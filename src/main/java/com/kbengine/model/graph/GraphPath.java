package com.kbengine.model.graph;

import java.util.List;

/**
 * Shortest walk between two nodes over domain edges, endpoints included.
 */
public record GraphPath(List<NodeRef> nodes) {

    public int length() {
        return Math.max(0, nodes.size() - 1);
    }
}
