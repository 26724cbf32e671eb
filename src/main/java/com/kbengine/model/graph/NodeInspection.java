package com.kbengine.model.graph;

import java.util.List;

public record NodeInspection(
    GraphNode node,

    Neighborhood neighborhood,

    List<GraphEdge> edges,

    List<ProvenanceEntry> provenance
) {}
