package com.kbengine.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kbengine.indexing.IndexRepositoryResult;
import com.kbengine.indexing.ItemError;
import com.kbengine.indexing.SyncResult;
import com.kbengine.model.DocumentReference;
import com.kbengine.model.RetrievalResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders command results as plain text or, with {@code --json}, as JSON using the same field names as the
 * REST responses. Errors go to stderr in text mode and to stdout in JSON mode.
 */
@Component
public class CommandOutput {

    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private final PrintStream err;

    @Autowired
    public CommandOutput(ObjectMapper objectMapper) {
        this(objectMapper, System.out, System.err);
    }

    CommandOutput(ObjectMapper objectMapper, PrintStream out, PrintStream err) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.out = out;
        this.err = err;
    }

    public void usage(String usage) {
        err.print(usage);
    }

    public void indexResult(IndexRepositoryResult result, boolean json) {
        if (json) {
            out.println(toJson(result));
            return;
        }
        if (result.repository() != null) {
            out.printf("Repository %s at %s%n", result.repository(), result.revision());
        }
        out.printf("Indexed %d of %d files (%d failed)%n", result.indexed(), result.filesFound(), result.failed());
        printErrors(result.errors());
    }

    public void syncResult(SyncResult result, boolean json) {
        if (json) {
            out.println(toJson(result));
            return;
        }
        out.printf("Synced to %s: %d indexed, %d deleted, %d skipped%n",
            result.currentRevision(), result.indexed(), result.deleted(), result.skipped());
        printErrors(result.errors());
    }

    public void searchResult(RetrievalResponse response, boolean json) {
        if (json) {
            out.println(toJson(response));
            return;
        }
        if (response.references().isEmpty()) {
            out.println("No results.");
            return;
        }
        int position = 1;
        for (DocumentReference reference : response.references()) {
            out.printf("%d. [%.3f] %s%n", position++, reference.score(), reference.title());
            out.printf("   %s%n", reference.url());
            if (reference.sectionTitle() != null) {
                out.printf("   section: %s%n", reference.sectionTitle());
            }
            if (reference.snippet() != null && !reference.snippet().isBlank()) {
                out.printf("   %s%n", reference.snippet());
            }
        }
        out.printf("%d results in %.1f ms (%s)%n", response.totalCount(), response.processingTimeMs(),
            response.references().get(0).retrievalMode().value());
    }

    /**
     * Graph query results. Text mode prints the same JSON, since the structures are nested.
     */
    public void value(Object value, boolean json) {
        out.println(toJson(value));
    }

    public void error(String message, Map<String, Object> details, boolean json) {
        if (json) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("error", message);
            body.put("details", details);
            out.println(toJson(body));
        } else {
            err.println("Error: " + message);
        }
    }

    private void printErrors(List<ItemError> errors) {
        for (ItemError error : errors) {
            err.printf("  failed: %s: %s%n", error.path(), error.message());
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render output", e);
        }
    }
}
