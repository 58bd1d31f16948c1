package com.netcourier.docqa.model;

import java.time.OffsetDateTime;
import java.util.List;

public record QueryHistoryEntry(long id,
                                String question,
                                String answer,
                                long elapsedMillis,
                                int chunksUsed,
                                List<String> chunkIds,
                                String backend,
                                String mode,
                                OffsetDateTime createdAt) {
}
