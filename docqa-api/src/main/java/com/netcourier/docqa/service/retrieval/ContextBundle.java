package com.netcourier.docqa.service.retrieval;

import java.util.List;

/**
 * Context chosen for one question, most relevant first.
 */
public record ContextBundle(String question, List<ContextChunk> chunks, int totalLength) {

    public ContextBundle {
        chunks = List.copyOf(chunks);
    }

    public static ContextBundle empty(String question) {
        return new ContextBundle(question, List.of(), 0);
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public List<String> chunkIds() {
        return chunks.stream().map(ContextChunk::chunkId).toList();
    }
}
