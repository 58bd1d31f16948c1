package com.netcourier.docqa.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.docqa.service.embedding.EmbeddingsClient;
import com.netcourier.docqa.service.vector.InMemoryVectorIndex;
import com.netcourier.docqa.service.vector.OpenSearchVectorIndex;
import com.netcourier.docqa.service.vector.QdrantVectorIndex;
import com.netcourier.docqa.service.vector.VectorIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;

/**
 * Picks the vector index variant named by {@code rag.vector.type}. The index dimension follows the embedding model.
 */
@Configuration
public class VectorIndexConfig {

    private static final Logger log = LoggerFactory.getLogger(VectorIndexConfig.class);

    @Bean
    public VectorIndex vectorIndex(RagProperties properties,
                                   EmbeddingsClient embeddingsClient,
                                   ObjectMapper objectMapper,
                                   @Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                                   @Qualifier("openSearchWebClient") WebClient openSearchWebClient) {
        RagProperties.Vector vector = properties.getVector();
        int dimensions = embeddingsClient.dimensions();
        VectorIndex index = switch (vector.getType()) {
            case IN_MEMORY -> {
                String snapshot = vector.getInMemory().getSnapshotPath();
                yield snapshot == null || snapshot.isBlank()
                        ? new InMemoryVectorIndex(dimensions)
                        : new InMemoryVectorIndex(dimensions, Path.of(snapshot), objectMapper);
            }
            case QDRANT -> new QdrantVectorIndex(qdrantWebClient, vector.getQdrant().getCollection(), dimensions,
                    vector.getTimeout(), vector.getRetryBackoff());
            case OPENSEARCH -> new OpenSearchVectorIndex(openSearchWebClient, vector.getOpensearch().getIndex(), dimensions,
                    vector.getOpensearch().getNumCandidates(), vector.getTimeout(), vector.getRetryBackoff());
        };
        log.info("Using {} vector index with {} dimensions", index.variant(), dimensions);
        return index;
    }
}
