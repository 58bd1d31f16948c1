package com.netcourier.docqa.service.ingestion;

import com.netcourier.docqa.model.IngestResponse;

public interface IngestionService {

    IngestResponse ingestDocument(IngestDocumentCommand command);

    IngestResponse ingestText(IngestTextCommand command);
}
