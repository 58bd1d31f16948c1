package com.netcourier.docqa.service.ingestion;

/**
 * Decoded text to ingest. Null chunking values fall back to the configured defaults.
 */
public record IngestTextCommand(String ownerId,
                                String title,
                                String text,
                                Integer chunkSize,
                                Integer overlap) {
}
