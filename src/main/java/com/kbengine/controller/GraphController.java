package com.kbengine.controller;

import com.kbengine.graph.GraphQueryService;
import com.kbengine.model.graph.GraphNode;
import com.kbengine.model.graph.GraphPath;
import com.kbengine.model.graph.GraphStats;
import com.kbengine.model.graph.ImpactEntry;
import com.kbengine.model.graph.NodeInspection;
import com.kbengine.model.graph.NodeKind;
import com.kbengine.model.graph.ProvenanceEntry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/graph")
@RequiredArgsConstructor
public class GraphController {

    private final GraphQueryService graphQueryService;

    @GetMapping("/nodes")
    public ResponseEntity<List<GraphNode>> listNodes(@RequestParam(name = "kind", required = false) String kind) {
        return ResponseEntity.ok(graphQueryService.listNodes(kind == null ? null : NodeKind.fromValue(kind)));
    }

    @GetMapping("/nodes/{id}")
    public ResponseEntity<NodeInspection> inspect(
        @PathVariable String id,
        @RequestParam(name = "depth", defaultValue = "1") int depth) {
        return ResponseEntity.ok(graphQueryService.inspect(id, depth));
    }

    @GetMapping("/nodes/{id}/provenance")
    public ResponseEntity<List<ProvenanceEntry>> provenance(@PathVariable String id) {
        return ResponseEntity.ok(graphQueryService.provenance(id));
    }

    @DeleteMapping("/nodes/{id}")
    public ResponseEntity<Void> deleteNode(@PathVariable String id) {
        graphQueryService.deleteNode(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/path")
    public ResponseEntity<GraphPath> path(
        @RequestParam(name = "from") String from,
        @RequestParam(name = "to") String to,
        @RequestParam(name = "max_depth", defaultValue = "5") int maxDepth) {
        return ResponseEntity.ok(graphQueryService.path(from, to, maxDepth));
    }

    @GetMapping("/documents/{documentId}/impact")
    public ResponseEntity<List<ImpactEntry>> impact(@PathVariable String documentId) {
        return ResponseEntity.ok(graphQueryService.impact(documentId));
    }

    @GetMapping("/stats")
    public ResponseEntity<GraphStats> stats() {
        return ResponseEntity.ok(graphQueryService.stats());
    }

    @PostMapping("/query")
    public ResponseEntity<List<Map<String, Object>>> query(@Valid @RequestBody GraphQueryRequest request) {
        return ResponseEntity.ok(graphQueryService.query(request.query(), request.parameters()));
    }
}
