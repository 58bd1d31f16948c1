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
 * Qdrant REST adapter. The collection is created with cosine distance on first use and every
 * search or delete carries an {@code owner_id} payload filter.
 */
public class QdrantVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndex.class);

    static final String OWNER_FIELD = "owner_id";
    static final String CHUNK_FIELD = "chunk_id";
    static final String DOCUMENT_FIELD = "document_id";
    static final String CHUNK_INDEX_FIELD = "chunk_index";

    private final WebClient qdrantWebClient;
    private final String collection;
    private final int dimensions;
    private final RemoteIndexCalls calls;
    private final AtomicBoolean collectionReady = new AtomicBoolean();

    public QdrantVectorIndex(WebClient qdrantWebClient,
                             String collection,
                             int dimensions,
                             Duration timeout,
                             Duration retryBackoff) {
        this.qdrantWebClient = qdrantWebClient;
        this.collection = collection;
        this.dimensions = dimensions;
        this.calls = new RemoteIndexCalls("Qdrant", timeout, retryBackoff);
    }

    @Override
    public void add(String ownerId, String chunkId, float[] vector, VectorMetadata metadata) {
        addAll(ownerId, List.of(new EmbeddedVector(chunkId, vector, metadata)));
    }

    @Override
    public void addAll(String ownerId, List<EmbeddedVector> vectors) {
        IndexArguments.requireOwner(ownerId);
        if (vectors.isEmpty()) {
            return;
        }
        List<Point> points = new ArrayList<>(vectors.size());
        for (EmbeddedVector vector : vectors) {
            IndexArguments.requireChunkId(vector.chunkId());
            IndexArguments.requireVector(vector.vector(), dimensions);
            points.add(new Point(IndexArguments.pointId(ownerId, vector.chunkId()), vector.vector(),
                    payloadFor(ownerId, vector)));
        }
        ensureCollection();
        calls.await(qdrantWebClient.put()
                .uri("/collections/{collection}/points?wait=true", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new UpsertRequest(points))
                .retrieve()
                .toBodilessEntity(), "upsert");
    }

    @Override
    public List<VectorMatch> search(String ownerId, float[] queryVector, int k, SearchFilters filters) {
        IndexArguments.requireOwner(ownerId);
        IndexArguments.requireVector(queryVector, dimensions);
        IndexArguments.requireK(k);
        ensureCollection();
        List<Map<String, Object>> must = new ArrayList<>(ownerFilter(ownerId));
        if (filters.restrictsDocuments()) {
            must.add(Map.of("key", DOCUMENT_FIELD, "match", Map.of("any", List.copyOf(filters.documentIds()))));
        }
        SearchRequest request = new SearchRequest(queryVector, k, Map.of("must", must), true);
        SearchResponse response = calls.await(qdrantWebClient.post()
                .uri("/collections/{collection}/points/search", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(SearchResponse.class), "search");
        if (response == null || response.result() == null) {
            return Collections.emptyList();
        }
        return response.result().stream()
                .filter(point -> point.payload() != null)
                .map(point -> new VectorMatch(point.payload().chunkId(), point.payload().documentId(),
                        point.payload().chunkIndex(), point.score()))
                .sorted(VectorMatch.RANKING)
                .limit(k)
                .toList();
    }

    @Override
    public void delete(String ownerId, String chunkId) {
        IndexArguments.requireOwner(ownerId);
        List<Map<String, Object>> must = new ArrayList<>(ownerFilter(ownerId));
        must.add(Map.of("key", CHUNK_FIELD, "match", Map.of("value", chunkId)));
        deleteMatching(must, "delete");
    }

    @Override
    public void deleteDocument(String ownerId, long documentId) {
        IndexArguments.requireOwner(ownerId);
        List<Map<String, Object>> must = new ArrayList<>(ownerFilter(ownerId));
        must.add(Map.of("key", DOCUMENT_FIELD, "match", Map.of("value", documentId)));
        deleteMatching(must, "document delete");
    }

    @Override
    public void deleteAll(String ownerId) {
        IndexArguments.requireOwner(ownerId);
        deleteMatching(ownerFilter(ownerId), "owner wipe");
    }

    @Override
    public VectorIndexVariant variant() {
        return VectorIndexVariant.QDRANT;
    }

    private void deleteMatching(List<Map<String, Object>> must, String action) {
        ensureCollection();
        calls.await(qdrantWebClient.post()
                .uri("/collections/{collection}/points/delete?wait=true", collection)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("filter", Map.of("must", must)))
                .retrieve()
                .toBodilessEntity(), action);
    }

    private void ensureCollection() {
        if (collectionReady.get()) {
            return;
        }
        Integer status = calls.await(qdrantWebClient.get()
                .uri("/collections/{collection}", collection)
                .exchangeToMono(response -> response.releaseBody().thenReturn(response.statusCode().value())), "collection lookup");
        if (status != null && status == HttpStatus.NOT_FOUND.value()) {
            Map<String, Object> body = Map.of("vectors", Map.of("size", dimensions, "distance", "Cosine"));
            calls.await(qdrantWebClient.put()
                    .uri("/collections/{collection}", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity(), "collection create");
            calls.await(qdrantWebClient.put()
                    .uri("/collections/{collection}/index?wait=true", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("field_name", OWNER_FIELD, "field_schema", "keyword"))
                    .retrieve()
                    .toBodilessEntity(), "payload index create");
            log.info("Created Qdrant collection {} with {} dimensions", collection, dimensions);
        } else if (status == null || status >= 400) {
            throw new IndexUnavailableException("Qdrant collection lookup returned " + status);
        }
        collectionReady.set(true);
    }

    private static List<Map<String, Object>> ownerFilter(String ownerId) {
        return List.of(Map.of("key", OWNER_FIELD, "match", Map.of("value", ownerId)));
    }

    private static Map<String, Object> payloadFor(String ownerId, EmbeddedVector vector) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(OWNER_FIELD, ownerId);
        payload.put(CHUNK_FIELD, vector.chunkId());
        payload.put(DOCUMENT_FIELD, vector.metadata().documentId());
        payload.put(CHUNK_INDEX_FIELD, vector.metadata().chunkIndex());
        return payload;
    }

    private record Point(String id, float[] vector, Map<String, Object> payload) {}

    private record UpsertRequest(List<Point> points) {}

    private record SearchRequest(float[] vector, int limit, Map<String, Object> filter,
                                 @JsonProperty("with_payload") boolean withPayload) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SearchResponse(List<ScoredPoint> result) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ScoredPoint(String id, double score, Payload payload) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Payload(@JsonProperty(CHUNK_FIELD) String chunkId,
                           @JsonProperty(DOCUMENT_FIELD) long documentId,
                           @JsonProperty(CHUNK_INDEX_FIELD) int chunkIndex) {}
}
