package com.netcourier.docqa.service.ingestion;

public record IngestDocumentCommand(String ownerId,
                                    String filename,
                                    byte[] bytes,
                                    Integer chunkSize,
                                    Integer overlap) {
}
