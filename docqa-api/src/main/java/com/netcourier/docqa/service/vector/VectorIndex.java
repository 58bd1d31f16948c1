package com.netcourier.docqa.service.vector;

import java.util.List;

/**
 * Similarity search over embedded chunks, partitioned by owner. Every operation is scoped to the
 * given owner inside the backing store; no call ever observes or touches another owner's vectors.
 * Remote variants raise {@link com.netcourier.docqa.service.error.IndexUnavailableException} when
 * the store cannot be reached.
 */
public interface VectorIndex {

    /**
     * Upserts the vector for {@code chunkId}; adding the same chunk id again replaces it.
     */
    void add(String ownerId, String chunkId, float[] vector, VectorMetadata metadata);

    default void addAll(String ownerId, List<EmbeddedVector> vectors) {
        for (EmbeddedVector vector : vectors) {
            add(ownerId, vector.chunkId(), vector.vector(), vector.metadata());
        }
    }

    /**
     * Returns at most {@code k} of the owner's vectors closest to {@code queryVector}, ordered by
     * {@link VectorMatch#RANKING}.
     */
    List<VectorMatch> search(String ownerId, float[] queryVector, int k, SearchFilters filters);

    default List<VectorMatch> search(String ownerId, float[] queryVector, int k) {
        return search(ownerId, queryVector, k, SearchFilters.none());
    }

    void delete(String ownerId, String chunkId);

    void deleteDocument(String ownerId, long documentId);

    void deleteAll(String ownerId);

    VectorIndexVariant variant();
}
