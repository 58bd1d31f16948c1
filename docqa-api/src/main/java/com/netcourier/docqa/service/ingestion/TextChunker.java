package com.netcourier.docqa.service.ingestion;

import java.util.List;

public interface TextChunker {

    List<Chunk> chunk(String text, ChunkingParameters parameters);
}
