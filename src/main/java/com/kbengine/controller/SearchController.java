package com.kbengine.controller;

import com.kbengine.model.ChunkType;
import com.kbengine.model.RetrievalMode;
import com.kbengine.model.RetrievalResponse;
import com.kbengine.model.SearchFilters;
import com.kbengine.model.SearchRequest;
import com.kbengine.retrieval.RetrievalPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/search")
@RequiredArgsConstructor
public class SearchController {

    private final RetrievalPipeline retrievalPipeline;

    @GetMapping
    public ResponseEntity<RetrievalResponse> search(
        @RequestParam(name = "q") String query,
        @RequestParam(name = "mode", required = false) String mode,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "threshold", required = false) Double threshold,
        @RequestParam(name = "domain", required = false) String domain,
        @RequestParam(name = "tags", required = false) List<String> tags,
        @RequestParam(name = "chunk_types", required = false) List<String> chunkTypes,
        @RequestParam(name = "document_ids", required = false) List<UUID> documentIds) {

        SearchFilters filters = new SearchFilters(
            domain,
            tags,
            chunkTypes == null ? null : chunkTypes.stream().map(ChunkType::fromLabel).toList(),
            documentIds
        );
        SearchRequest request = new SearchRequest(query, RetrievalMode.fromValue(mode), filters, limit, threshold);
        return ResponseEntity.ok(retrievalPipeline.search(request));
    }
}
