package com.kbengine.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbengine.config.SecurityConfig;
import com.kbengine.exception.EntityNotFoundException;
import com.kbengine.exception.PipelineException;
import com.kbengine.indexing.DocumentFactory;
import com.kbengine.indexing.IndexationOrchestrator;
import com.kbengine.model.ContentFormat;
import com.kbengine.model.Document;
import com.kbengine.model.DocumentStatus;
import com.kbengine.repository.DocumentStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentController.class)
@Import({SecurityConfig.class, DocumentFactory.class})
@WithMockUser(username = "kb_admin")
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private IndexationOrchestrator orchestrator;

    @MockitoBean
    private DocumentStore documentStore;

    private static Document indexed(UUID id) {
        return Document.builder()
            .id(id)
            .title("User")
            .content("# User")
            .contentHash("hash")
            .status(DocumentStatus.INDEXED)
            .externalId("crm:user")
            .tags(List.of("core"))
            .createdAt(OffsetDateTime.now())
            .indexedAt(OffsetDateTime.now())
            .build();
    }

    @Test
    @DisplayName("POST /documents should index the submitted content and return 201")
    void createDocument_ShouldReturn201() throws Exception {
        UUID id = UUID.randomUUID();
        ArgumentCaptor<Document> submitted = ArgumentCaptor.forClass(Document.class);
        when(orchestrator.index(submitted.capture())).thenReturn(indexed(id));
        DocumentRequest request = new DocumentRequest("User", "# User", ContentFormat.MARKDOWN, "sales",
            List.of("core"), "crm:user");

        mockMvc.perform(post("/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(id.toString()))
            .andExpect(jsonPath("$.status").value("INDEXED"))
            .andExpect(jsonPath("$.external_id").value("crm:user"))
            .andExpect(jsonPath("$.content_hash").value("hash"));

        assertThat(submitted.getValue().title()).isEqualTo("User");
        assertThat(submitted.getValue().domain()).isEqualTo("sales");
        assertThat(submitted.getValue().externalId()).isEqualTo("crm:user");
    }

    @Test
    @DisplayName("POST /documents should return 400 with field details when content is blank")
    void createDocument_ShouldReturn400_WhenContentBlank() throws Exception {
        mockMvc.perform(post("/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"User\", \"content\": \" \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid request body"))
            .andExpect(jsonPath("$.details.content").exists());

        verify(orchestrator, never()).index(any());
    }

    @Test
    @DisplayName("POST /documents should return 422 when indexing fails")
    void createDocument_ShouldReturn422_WhenPipelineFails() throws Exception {
        when(orchestrator.index(any())).thenThrow(new PipelineException("d-1", "Failed to index document: quota exhausted", null));

        mockMvc.perform(post("/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"User\", \"content\": \"# User\"}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.message").value("Failed to index document: quota exhausted"))
            .andExpect(jsonPath("$.details.documentId").value("d-1"));
    }

    @Test
    @DisplayName("POST /documents should return 409 on a duplicate external id")
    void createDocument_ShouldReturn409_WhenDuplicate() throws Exception {
        when(orchestrator.index(any())).thenThrow(new DuplicateKeyException("documents_external_id_key"));

        mockMvc.perform(post("/documents")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"title\": \"User\", \"content\": \"# User\"}"))
            .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("GET /documents/{id} should return document details")
    void getDocument_ShouldReturnDetails() throws Exception {
        UUID id = UUID.randomUUID();
        when(documentStore.findById(id)).thenReturn(Optional.of(indexed(id)));

        mockMvc.perform(get("/documents/{id}", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.title").value("User"))
            .andExpect(jsonPath("$.tags[0]").value("core"));
    }

    @Test
    @DisplayName("GET /documents/{id} should return 404 when document does not exist")
    void getDocument_ShouldReturn404_WhenNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(documentStore.findById(id)).thenReturn(Optional.empty());

        mockMvc.perform(get("/documents/{id}", id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Document not found: " + id))
            .andExpect(jsonPath("$.details.id").value(id.toString()));
    }

    @Test
    @DisplayName("GET /documents/{id} should return 400 for a malformed id")
    void getDocument_ShouldReturn400_WhenIdMalformed() throws Exception {
        mockMvc.perform(get("/documents/{id}", "not-a-uuid"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /documents/{id}/reindex should return the reindexed document")
    void reindex_ShouldReturnDocument() throws Exception {
        UUID id = UUID.randomUUID();
        when(orchestrator.reindexDocument(id)).thenReturn(indexed(id));

        mockMvc.perform(post("/documents/{id}/reindex", id))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(id.toString()));
    }

    @Test
    @DisplayName("POST /documents/{id}/reindex should return 404 for an unknown document")
    void reindex_ShouldReturn404_WhenNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(orchestrator.reindexDocument(id)).thenThrow(new EntityNotFoundException("Document", id));

        mockMvc.perform(post("/documents/{id}/reindex", id))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("DELETE /documents/{id} should return 204, or 404 when nothing was deleted")
    void delete_ShouldReturn204Or404() throws Exception {
        UUID existing = UUID.randomUUID();
        UUID missing = UUID.randomUUID();
        when(orchestrator.deleteDocument(existing)).thenReturn(true);
        when(orchestrator.deleteDocument(missing)).thenReturn(false);

        mockMvc.perform(delete("/documents/{id}", existing))
            .andExpect(status().isNoContent());
        mockMvc.perform(delete("/documents/{id}", missing))
            .andExpect(status().isNotFound());
    }
}
