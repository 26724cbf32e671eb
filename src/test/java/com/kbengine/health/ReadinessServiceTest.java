package com.kbengine.health;

import com.kbengine.exception.StoreUnavailableException;
import com.kbengine.graph.GraphStore;
import com.kbengine.repository.DocumentStore;
import com.kbengine.repository.VectorIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.SQLException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.doThrow;

@ExtendWith(MockitoExtension.class)
class ReadinessServiceTest {

    @Mock
    private DocumentStore documentStore;

    @Mock
    private VectorIndex vectorIndex;

    @Mock
    private GraphStore graphStore;

    @Test
    @DisplayName("All stores answering means ready")
    void allStoresUp() {
        ReadinessReport report = new ReadinessService(documentStore, vectorIndex, Optional.of(graphStore)).check();

        assertThat(report.ready()).isTrue();
        assertThat(report.status()).isEqualTo("ready");
        assertThat(report.stores()).containsExactly(
            entry("documents", "up"),
            entry("vectors", "up"),
            entry("graph", "up"));
    }

    @Test
    @DisplayName("An unreachable store is named in the report")
    void storeDown() {
        doThrow(new StoreUnavailableException("graph", new SQLException("connection refused"))).when(graphStore).ping();

        ReadinessReport report = new ReadinessService(documentStore, vectorIndex, Optional.of(graphStore)).check();

        assertThat(report.ready()).isFalse();
        assertThat(report.status()).isEqualTo("not_ready");
        assertThat(report.unavailable()).containsExactly("graph");
        assertThat(report.stores()).containsEntry("graph", "down").containsEntry("documents", "up");
    }

    @Test
    @DisplayName("Without a graph backend the graph probe is skipped")
    void noGraphBackend() {
        ReadinessReport report = new ReadinessService(documentStore, vectorIndex, Optional.empty()).check();

        assertThat(report.ready()).isTrue();
        assertThat(report.stores()).containsEntry("graph", "skipped");
    }
}
