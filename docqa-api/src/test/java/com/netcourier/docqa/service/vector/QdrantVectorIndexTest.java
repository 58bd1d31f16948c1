package com.netcourier.docqa.service.vector;

import com.netcourier.docqa.service.error.IndexUnavailableException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QdrantVectorIndexTest extends VectorIndexContract {

    private FakeQdrantServer server;

    @Override
    VectorIndex createIndex() {
        server = new FakeQdrantServer("qa_documents");
        return new QdrantVectorIndex(server.webClient(), "qa_documents", DIMENSIONS,
                Duration.ofSeconds(2), Duration.ofMillis(10));
    }

    @Test
    void createsCosineCollectionOnFirstUse() {
        index.add("alice", "1-0", withCosine(0.9), new VectorMetadata(1, 0));
        index.add("alice", "1-1", withCosine(0.8), new VectorMetadata(1, 1));

        assertThat(server.collectionDefinition.path("vectors").path("size").asInt()).isEqualTo(DIMENSIONS);
        assertThat(server.collectionDefinition.path("vectors").path("distance").asText()).isEqualTo("Cosine");
        assertThat(server.requests).filteredOn(request -> request.equals("PUT /collections/qa_documents")).hasSize(1);
        assertThat(server.requests).contains("PUT /collections/qa_documents/index");
    }

    @Test
    void storesOwnerInPayloadAndUsesDerivedPointIds() {
        index.add("alice", "1-0", withCosine(0.9), new VectorMetadata(1, 0));

        assertThat(IndexArguments.pointId("alice", "1-0"))
                .isNotEqualTo(IndexArguments.pointId("bob", "1-0"))
                .hasSize(36);
    }

    @Test
    void retriesATransientFailureOnce() {
        index.add("alice", "1-0", withCosine(0.9), new VectorMetadata(1, 0));
        server.failuresToInject.set(1);

        assertThat(index.search("alice", QUERY, 3)).hasSize(1);
    }

    @Test
    void persistentFailureSurfacesAsIndexUnavailable() {
        index.add("alice", "1-0", withCosine(0.9), new VectorMetadata(1, 0));
        server.failuresToInject.set(5);

        assertThatThrownBy(() -> index.search("alice", QUERY, 3))
                .isInstanceOf(IndexUnavailableException.class)
                .hasMessageContaining("Qdrant search failed");
    }
}
