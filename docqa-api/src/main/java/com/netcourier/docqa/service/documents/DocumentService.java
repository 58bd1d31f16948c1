package com.netcourier.docqa.service.documents;

import com.netcourier.docqa.model.DocumentSummary;

import java.util.List;

public interface DocumentService {

    List<DocumentSummary> list(String ownerId);

    /**
     * @throws com.netcourier.docqa.service.error.NotFoundException when the owner has no such document
     */
    DocumentSummary get(String ownerId, long documentId);

    /**
     * Removes the document with its chunks and vectors. Unknown ids are ignored.
     */
    void delete(String ownerId, long documentId);

    /**
     * Re-embeds every stored chunk of the owner and upserts the vectors again.
     *
     * @return number of chunks re-indexed
     */
    int reindex(String ownerId);

    /**
     * Removes every document, chunk, vector and query log of the owner.
     *
     * @return number of documents removed
     */
    int wipe(String ownerId);
}
