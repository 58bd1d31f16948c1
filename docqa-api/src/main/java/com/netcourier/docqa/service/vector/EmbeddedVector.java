package com.netcourier.docqa.service.vector;

public record EmbeddedVector(String chunkId, float[] vector, VectorMetadata metadata) {
}
