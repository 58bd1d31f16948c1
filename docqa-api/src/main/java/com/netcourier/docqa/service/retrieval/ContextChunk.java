package com.netcourier.docqa.service.retrieval;

public record ContextChunk(String chunkId, long documentId, int chunkIndex, String text, double score) {
}
