package com.netcourier.docqa.service.vector;

import java.util.Comparator;

/**
 * A search hit. {@code score} is comparable only against other hits of the same call.
 */
public record VectorMatch(String chunkId, long documentId, int chunkIndex, double score) {

    /**
     * Descending score; ties go to the lower document id, then the lower chunk index.
     */
    public static final Comparator<VectorMatch> RANKING = Comparator
            .comparingDouble(VectorMatch::score).reversed()
            .thenComparingLong(VectorMatch::documentId)
            .thenComparingInt(VectorMatch::chunkIndex);
}
