package com.netcourier.docqa.service.vector;

public record VectorMetadata(long documentId, int chunkIndex) {
}
