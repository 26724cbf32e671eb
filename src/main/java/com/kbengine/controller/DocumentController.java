package com.kbengine.controller;

import com.kbengine.exception.EntityNotFoundException;
import com.kbengine.indexing.DocumentFactory;
import com.kbengine.indexing.IndexationOrchestrator;
import com.kbengine.model.Document;
import com.kbengine.repository.DocumentStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final IndexationOrchestrator orchestrator;
    private final DocumentStore documentStore;
    private final DocumentFactory documentFactory;

    @PostMapping
    public ResponseEntity<DocumentResponse> createDocument(@Valid @RequestBody DocumentRequest request) {
        Document document = documentFactory.fromContent(
            request.title(),
            request.content(),
            request.format(),
            request.domain(),
            request.tags(),
            request.externalId()
        );
        Document indexed = orchestrator.index(document);
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(indexed));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID id) {
        Document document = documentStore.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Document", id));
        return ResponseEntity.ok(DocumentResponse.from(document));
    }

    @PostMapping("/{id}/reindex")
    public ResponseEntity<DocumentResponse> reindexDocument(@PathVariable UUID id) {
        return ResponseEntity.ok(DocumentResponse.from(orchestrator.reindexDocument(id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDocument(@PathVariable UUID id) {
        if (!orchestrator.deleteDocument(id)) {
            throw new EntityNotFoundException("Document", id);
        }
        return ResponseEntity.noContent().build();
    }
}
