package com.netcourier.docqa.service.ingestion;

import com.netcourier.docqa.service.error.InvalidParametersException;

public record ChunkingParameters(int targetSize, int overlap) {

    public ChunkingParameters {
        if (targetSize <= 0) {
            throw new InvalidParametersException("Chunk size must be positive");
        }
        if (overlap < 0 || overlap >= targetSize) {
            throw new InvalidParametersException("Chunk overlap must be between 0 and chunk size - 1");
        }
    }
}
