package com.netcourier.docqa.model;

import java.time.OffsetDateTime;

public record DocumentSummary(long id,
                              String title,
                              String contentType,
                              int chunks,
                              long sizeBytes,
                              OffsetDateTime createdAt) {
}
