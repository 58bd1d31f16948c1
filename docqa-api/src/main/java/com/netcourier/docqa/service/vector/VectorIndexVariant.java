package com.netcourier.docqa.service.vector;

public enum VectorIndexVariant {
    IN_MEMORY,
    QDRANT,
    OPENSEARCH
}
