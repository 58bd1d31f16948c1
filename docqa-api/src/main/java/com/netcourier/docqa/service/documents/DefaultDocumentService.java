package com.netcourier.docqa.service.documents;

import com.netcourier.docqa.model.DocumentSummary;
import com.netcourier.docqa.persistence.entity.DocumentChunkEntity;
import com.netcourier.docqa.persistence.entity.DocumentEntity;
import com.netcourier.docqa.persistence.repository.DocumentChunkRepository;
import com.netcourier.docqa.persistence.repository.DocumentRepository;
import com.netcourier.docqa.persistence.repository.QueryLogRepository;
import com.netcourier.docqa.service.embedding.EmbeddingsClient;
import com.netcourier.docqa.service.error.InvalidParametersException;
import com.netcourier.docqa.service.error.NotFoundException;
import com.netcourier.docqa.service.vector.EmbeddedVector;
import com.netcourier.docqa.service.vector.VectorIndex;
import com.netcourier.docqa.service.vector.VectorMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class DefaultDocumentService implements DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DefaultDocumentService.class);

    private static final int REINDEX_BATCH_SIZE = 64;

    private final DocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;
    private final QueryLogRepository queryLogRepository;
    private final EmbeddingsClient embeddingsClient;
    private final VectorIndex vectorIndex;

    public DefaultDocumentService(DocumentRepository documentRepository,
                                  DocumentChunkRepository chunkRepository,
                                  QueryLogRepository queryLogRepository,
                                  EmbeddingsClient embeddingsClient,
                                  VectorIndex vectorIndex) {
        this.documentRepository = documentRepository;
        this.chunkRepository = chunkRepository;
        this.queryLogRepository = queryLogRepository;
        this.embeddingsClient = embeddingsClient;
        this.vectorIndex = vectorIndex;
    }

    @Override
    public List<DocumentSummary> list(String ownerId) {
        requireOwner(ownerId);
        return documentRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId).stream()
                .map(DefaultDocumentService::summary)
                .toList();
    }

    @Override
    public DocumentSummary get(String ownerId, long documentId) {
        requireOwner(ownerId);
        return documentRepository.findByIdAndOwnerId(documentId, ownerId)
                .map(DefaultDocumentService::summary)
                .orElseThrow(() -> new NotFoundException("Document " + documentId + " not found"));
    }

    @Override
    public void delete(String ownerId, long documentId) {
        requireOwner(ownerId);
        Optional<DocumentEntity> document = documentRepository.findByIdAndOwnerId(documentId, ownerId);
        if (document.isEmpty()) {
            log.debug("Document {} of owner {} already absent", documentId, ownerId);
            return;
        }
        // Vectors first: a search must never return a chunk whose text is gone.
        vectorIndex.deleteDocument(ownerId, documentId);
        chunkRepository.deleteByDocument(ownerId, documentId);
        documentRepository.delete(document.get());
        log.info("Deleted document {} for owner {}", documentId, ownerId);
    }

    @Override
    public int reindex(String ownerId) {
        requireOwner(ownerId);
        List<DocumentChunkEntity> chunks = chunkRepository.findByOwnerIdOrderByDocumentIdAscChunkIndexAsc(ownerId);
        for (int from = 0; from < chunks.size(); from += REINDEX_BATCH_SIZE) {
            List<DocumentChunkEntity> batch = chunks.subList(from, Math.min(from + REINDEX_BATCH_SIZE, chunks.size()));
            List<float[]> vectors = embeddingsClient.embedMany(batch.stream().map(DocumentChunkEntity::getContent).toList());
            List<EmbeddedVector> embedded = new ArrayList<>(batch.size());
            for (int i = 0; i < batch.size(); i++) {
                DocumentChunkEntity chunk = batch.get(i);
                embedded.add(new EmbeddedVector(chunk.getChunkId(), vectors.get(i),
                        new VectorMetadata(chunk.getDocumentId(), chunk.getChunkIndex())));
            }
            vectorIndex.addAll(ownerId, embedded);
        }
        log.info("Re-indexed {} chunks for owner {} with model {}", chunks.size(), ownerId, embeddingsClient.model());
        return chunks.size();
    }

    @Override
    public int wipe(String ownerId) {
        requireOwner(ownerId);
        vectorIndex.deleteAll(ownerId);
        chunkRepository.deleteByOwner(ownerId);
        int documents = documentRepository.deleteByOwner(ownerId);
        int queries = queryLogRepository.deleteByOwner(ownerId);
        log.info("Wiped owner {}: {} documents, {} query logs", ownerId, documents, queries);
        return documents;
    }

    private static DocumentSummary summary(DocumentEntity document) {
        return new DocumentSummary(document.getId(), document.getTitle(), document.getContentType(),
                document.getChunkCount(), document.getSizeBytes(), document.getCreatedAt());
    }

    private static void requireOwner(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new InvalidParametersException("Owner id is required");
        }
    }
}
