package com.netcourier.docqa.service.vector;

import com.netcourier.docqa.service.error.IndexUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenSearchVectorIndexTest extends VectorIndexContract {

    private FakeOpenSearchServer server;

    @Override
    VectorIndex createIndex() {
        server = new FakeOpenSearchServer("qa_documents");
        return new OpenSearchVectorIndex(server.webClient(), "qa_documents", DIMENSIONS, 100,
                Duration.ofSeconds(2), Duration.ofMillis(10));
    }

    @Test
    void createsKnnIndexWithCosineSpace() {
        index.add("alice", "1-0", withCosine(0.9), new VectorMetadata(1, 0));

        assertThat(server.indexDefinition.path("settings").path("index").path("knn").asBoolean()).isTrue();
        assertThat(server.indexDefinition.path("mappings").path("properties").path("embedding").path("method")
                .path("space_type").asText()).isEqualTo("cosinesimil");
        assertThat(server.indexDefinition.path("mappings").path("properties").path("owner_id").path("type").asText())
                .isEqualTo("keyword");
    }

    @Test
    void searchReportsCosineRatherThanRawScore() {
        index.add("alice", "1-0", withCosine(0.0), new VectorMetadata(1, 0));

        assertThat(index.search("alice", QUERY, 1).get(0).score()).isBetween(-1e-6, 1e-6);
    }

    @Test
    void unreachableClusterSurfacesAsIndexUnavailable() {
        server.failuresToInject.set(5);

        assertThatThrownBy(() -> index.add("alice", "1-0", withCosine(0.9), new VectorMetadata(1, 0)))
                .isInstanceOf(IndexUnavailableException.class);
    }
}
