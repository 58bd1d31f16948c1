package com.netcourier.docqa.model;

public record IngestResponse(long documentId,
                             String title,
                             int chunks,
                             long sizeBytes,
                             boolean deduplicated) {
}
