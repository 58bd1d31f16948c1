package com.netcourier.docqa.service.vector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.netcourier.docqa.service.error.IndexUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OpenSearch REST adapter backed by a {@code knn_vector} field in the cosine space. The owner
 * {@code term} filter is applied inside the k-NN query so other owners' vectors never become
 * candidates.
 */
public class OpenSearchVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(OpenSearchVectorIndex.class);

    static final String OWNER_FIELD = "owner_id";
    static final String CHUNK_FIELD = "chunk_id";
    static final String DOCUMENT_FIELD = "document_id";
    static final String CHUNK_INDEX_FIELD = "chunk_index";
    static final String VECTOR_FIELD = "embedding";

    private final WebClient openSearchWebClient;
    private final String index;
    private final int dimensions;
    private final int numCandidates;
    private final RemoteIndexCalls calls;
    private final AtomicBoolean indexReady = new AtomicBoolean();

    public OpenSearchVectorIndex(WebClient openSearchWebClient,
                                 String index,
                                 int dimensions,
                                 int numCandidates,
                                 Duration timeout,
                                 Duration retryBackoff) {
        this.openSearchWebClient = openSearchWebClient;
        this.index = index;
        this.dimensions = dimensions;
        this.numCandidates = numCandidates;
        this.calls = new RemoteIndexCalls("OpenSearch", timeout, retryBackoff);
    }

    @Override
    public void add(String ownerId, String chunkId, float[] vector, VectorMetadata metadata) {
        IndexArguments.requireOwner(ownerId);
        IndexArguments.requireChunkId(chunkId);
        IndexArguments.requireVector(vector, dimensions);
        ensureIndex();
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(OWNER_FIELD, ownerId);
        document.put(CHUNK_FIELD, chunkId);
        document.put(DOCUMENT_FIELD, metadata.documentId());
        document.put(CHUNK_INDEX_FIELD, metadata.chunkIndex());
        document.put(VECTOR_FIELD, vector);
        calls.await(openSearchWebClient.put()
                .uri("/{index}/_doc/{id}?refresh=true", index, IndexArguments.pointId(ownerId, chunkId))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(document)
                .retrieve()
                .toBodilessEntity(), "index");
    }

    @Override
    public List<VectorMatch> search(String ownerId, float[] queryVector, int k, SearchFilters filters) {
        IndexArguments.requireOwner(ownerId);
        IndexArguments.requireVector(queryVector, dimensions);
        IndexArguments.requireK(k);
        ensureIndex();
        List<Map<String, Object>> filter = new ArrayList<>(ownerFilter(ownerId));
        if (filters.restrictsDocuments()) {
            filter.add(Map.of("terms", Map.of(DOCUMENT_FIELD, List.copyOf(filters.documentIds()))));
        }
        Map<String, Object> knn = new LinkedHashMap<>();
        knn.put("vector", queryVector);
        knn.put("k", Math.max(k, numCandidates));
        knn.put("filter", Map.of("bool", Map.of("filter", filter)));
        SearchRequest request = new SearchRequest(k,
                Map.of("knn", Map.of(VECTOR_FIELD, knn)),
                List.of(CHUNK_FIELD, DOCUMENT_FIELD, CHUNK_INDEX_FIELD));
        SearchResponse response = calls.await(openSearchWebClient.post()
                .uri("/{index}/_search", index)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(SearchResponse.class), "search");
        if (response == null || response.hits() == null || response.hits().hits() == null) {
            return Collections.emptyList();
        }
        // cosinesimil scores are (1 + cos) / 2; map back so every variant reports cosine.
        return response.hits().hits().stream()
                .filter(hit -> hit.source() != null)
                .map(hit -> new VectorMatch(hit.source().chunkId(), hit.source().documentId(),
                        hit.source().chunkIndex(), hit.score() * 2d - 1d))
                .sorted(VectorMatch.RANKING)
                .limit(k)
                .toList();
    }

    @Override
    public void delete(String ownerId, String chunkId) {
        IndexArguments.requireOwner(ownerId);
        List<Map<String, Object>> filter = new ArrayList<>(ownerFilter(ownerId));
        filter.add(Map.of("term", Map.of(CHUNK_FIELD, chunkId)));
        deleteByQuery(filter, "delete");
    }

    @Override
    public void deleteDocument(String ownerId, long documentId) {
        IndexArguments.requireOwner(ownerId);
        List<Map<String, Object>> filter = new ArrayList<>(ownerFilter(ownerId));
        filter.add(Map.of("term", Map.of(DOCUMENT_FIELD, documentId)));
        deleteByQuery(filter, "document delete");
    }

    @Override
    public void deleteAll(String ownerId) {
        IndexArguments.requireOwner(ownerId);
        deleteByQuery(ownerFilter(ownerId), "owner wipe");
    }

    @Override
    public VectorIndexVariant variant() {
        return VectorIndexVariant.OPENSEARCH;
    }

    private void deleteByQuery(List<Map<String, Object>> filter, String action) {
        ensureIndex();
        calls.await(openSearchWebClient.post()
                .uri("/{index}/_delete_by_query?refresh=true", index)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", Map.of("bool", Map.of("filter", filter))))
                .retrieve()
                .toBodilessEntity(), action);
    }

    private void ensureIndex() {
        if (indexReady.get()) {
            return;
        }
        Integer status = calls.await(openSearchWebClient.head()
                .uri("/{index}", index)
                .exchangeToMono(response -> response.releaseBody().thenReturn(response.statusCode().value())), "index lookup");
        if (status != null && status == HttpStatus.NOT_FOUND.value()) {
            calls.await(openSearchWebClient.put()
                    .uri("/{index}", index)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(indexDefinition())
                    .retrieve()
                    .toBodilessEntity(), "index create");
            log.info("Created OpenSearch index {} with {} dimensions", index, dimensions);
        } else if (status == null || status >= 400) {
            throw new IndexUnavailableException("OpenSearch index lookup returned " + status);
        }
        indexReady.set(true);
    }

    private Map<String, Object> indexDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(OWNER_FIELD, Map.of("type", "keyword"));
        properties.put(CHUNK_FIELD, Map.of("type", "keyword"));
        properties.put(DOCUMENT_FIELD, Map.of("type", "long"));
        properties.put(CHUNK_INDEX_FIELD, Map.of("type", "integer"));
        properties.put(VECTOR_FIELD, Map.of(
                "type", "knn_vector",
                "dimension", dimensions,
                "method", Map.of("name", "hnsw", "space_type", "cosinesimil", "engine", "lucene")));
        return Map.of(
                "settings", Map.of("index", Map.of("knn", true)),
                "mappings", Map.of("properties", properties));
    }

    private static List<Map<String, Object>> ownerFilter(String ownerId) {
        return List.of(Map.of("term", Map.of(OWNER_FIELD, ownerId)));
    }

    private record SearchRequest(int size, Map<String, Object> query, @JsonProperty("_source") List<String> source) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SearchResponse(Hits hits) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Hits(List<Hit> hits) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Hit(@JsonProperty("_id") String id,
                       @JsonProperty("_score") double score,
                       @JsonProperty("_source") Source source) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Source(@JsonProperty(CHUNK_FIELD) String chunkId,
                          @JsonProperty(DOCUMENT_FIELD) long documentId,
                          @JsonProperty(CHUNK_INDEX_FIELD) int chunkIndex) {}
}
