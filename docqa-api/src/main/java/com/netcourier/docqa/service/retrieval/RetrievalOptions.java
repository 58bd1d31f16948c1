package com.netcourier.docqa.service.retrieval;

import com.netcourier.docqa.service.error.InvalidParametersException;
import com.netcourier.docqa.service.vector.SearchFilters;

/**
 * @param k                how many nearest chunks to fetch from the index
 * @param maxContextLength character budget for the assembled context
 */
public record RetrievalOptions(int k, int maxContextLength, SearchFilters filters) {

    public static final int DEFAULT_K = 5;
    public static final int DEFAULT_MAX_CONTEXT_LENGTH = 4000;

    public RetrievalOptions {
        if (k < 1) {
            throw new InvalidParametersException("k must be at least 1");
        }
        if (maxContextLength < 1) {
            throw new InvalidParametersException("maxContextLength must be at least 1");
        }
        filters = filters == null ? SearchFilters.none() : filters;
    }

    public RetrievalOptions(int k, int maxContextLength) {
        this(k, maxContextLength, SearchFilters.none());
    }

    public static RetrievalOptions defaults() {
        return new RetrievalOptions(DEFAULT_K, DEFAULT_MAX_CONTEXT_LENGTH);
    }
}
