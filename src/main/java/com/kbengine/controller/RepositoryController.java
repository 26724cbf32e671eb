package com.kbengine.controller;

import com.kbengine.exception.ValidationException;
import com.kbengine.indexing.IndexRepositoryResult;
import com.kbengine.indexing.IndexationOrchestrator;
import com.kbengine.indexing.SyncResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/repositories")
@RequiredArgsConstructor
public class RepositoryController {

    private final IndexationOrchestrator orchestrator;

    @PostMapping("/index")
    public ResponseEntity<IndexRepositoryResult> indexRepository(@Valid @RequestBody RepositoryRequest request) {
        return ResponseEntity.ok(orchestrator.indexRepository(request.toConfig()));
    }

    @PostMapping("/sync")
    public ResponseEntity<SyncResult> syncRepository(@Valid @RequestBody RepositoryRequest request) {
        if (request.since() == null || request.since().isBlank()) {
            throw new ValidationException("Field 'since' is required for sync");
        }
        return ResponseEntity.ok(orchestrator.syncRepository(request.toConfig(), request.since()));
    }
}
