package com.netcourier.docqa.service.vector;

import java.util.Collection;
import java.util.Set;

/**
 * Optional narrowing of a search to a subset of the owner's documents. An empty set means no restriction.
 */
public record SearchFilters(Set<Long> documentIds) {

    private static final SearchFilters NONE = new SearchFilters(Set.of());

    public SearchFilters {
        documentIds = documentIds == null ? Set.of() : Set.copyOf(documentIds);
    }

    public static SearchFilters none() {
        return NONE;
    }

    public static SearchFilters documents(Collection<Long> documentIds) {
        return new SearchFilters(Set.copyOf(documentIds));
    }

    public boolean restrictsDocuments() {
        return !documentIds.isEmpty();
    }

    public boolean accepts(long documentId) {
        return documentIds.isEmpty() || documentIds.contains(documentId);
    }
}
