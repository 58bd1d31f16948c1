package com.netcourier.docqa.service.ingestion;

import com.netcourier.docqa.config.RagProperties;
import com.netcourier.docqa.model.IngestResponse;
import com.netcourier.docqa.persistence.entity.DocumentChunkEntity;
import com.netcourier.docqa.persistence.entity.DocumentEntity;
import com.netcourier.docqa.persistence.repository.DocumentChunkRepository;
import com.netcourier.docqa.persistence.repository.DocumentRepository;
import com.netcourier.docqa.service.embedding.EmbeddingsClient;
import com.netcourier.docqa.service.error.InvalidParametersException;
import com.netcourier.docqa.service.error.QuotaExceededException;
import com.netcourier.docqa.service.vector.EmbeddedVector;
import com.netcourier.docqa.service.vector.VectorIndex;
import com.netcourier.docqa.service.vector.VectorMetadata;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class DefaultIngestionService implements IngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);

    private final DocumentTextExtractor textExtractor;
    private final TextChunker textChunker;
    private final EmbeddingsClient embeddingsClient;
    private final VectorIndex vectorIndex;
    private final DocumentRepository documentRepository;
    private final DocumentChunkRepository chunkRepository;
    private final IngestionLocks ingestionLocks;
    private final TransactionTemplate transactionTemplate;
    private final RagProperties properties;
    private final MeterRegistry meterRegistry;
    private final Counter acceptedCounter;
    private final Counter dedupCounter;
    private final Counter rejectedCounter;
    private final Timer ingestionTimer;

    public DefaultIngestionService(DocumentTextExtractor textExtractor,
                                   TextChunker textChunker,
                                   EmbeddingsClient embeddingsClient,
                                   VectorIndex vectorIndex,
                                   DocumentRepository documentRepository,
                                   DocumentChunkRepository chunkRepository,
                                   IngestionLocks ingestionLocks,
                                   PlatformTransactionManager transactionManager,
                                   RagProperties properties,
                                   MeterRegistry meterRegistry) {
        this.textExtractor = textExtractor;
        this.textChunker = textChunker;
        this.embeddingsClient = embeddingsClient;
        this.vectorIndex = vectorIndex;
        this.documentRepository = documentRepository;
        this.chunkRepository = chunkRepository;
        this.ingestionLocks = ingestionLocks;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.acceptedCounter = meterRegistry.counter("rag.ingest.events", "outcome", "accepted");
        this.dedupCounter = meterRegistry.counter("rag.ingest.events", "outcome", "deduplicated");
        this.rejectedCounter = meterRegistry.counter("rag.ingest.events", "outcome", "rejected");
        this.ingestionTimer = meterRegistry.timer("rag.ingest.duration");
    }

    @Override
    public IngestResponse ingestDocument(IngestDocumentCommand command) {
        if (command == null || command.bytes() == null || command.bytes().length == 0) {
            throw new InvalidParametersException("Uploaded file is empty");
        }
        DocumentTextExtractor.ExtractedDocument extracted;
        try (InputStream inputStream = new ByteArrayInputStream(command.bytes())) {
            extracted = textExtractor.extract(command.filename(), inputStream);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded document", e);
        }
        if (extracted.text() == null || extracted.text().isBlank()) {
            throw new InvalidParametersException("No text could be extracted from " + command.filename());
        }
        ChunkingParameters parameters = chunkingParameters(command.chunkSize(), command.overlap());
        return ingest(command.ownerId(), extracted.title(), extracted.contentType(), command.bytes(), extracted.text(), parameters);
    }

    @Override
    public IngestResponse ingestText(IngestTextCommand command) {
        if (command == null || command.text() == null || command.text().isBlank()) {
            throw new InvalidParametersException("Text payload must not be empty");
        }
        String title = command.title() == null || command.title().isBlank() ? "Document" : command.title().trim();
        ChunkingParameters parameters = chunkingParameters(command.chunkSize(), command.overlap());
        byte[] bytes = command.text().getBytes(StandardCharsets.UTF_8);
        return ingest(command.ownerId(), title, "text/plain", bytes, command.text(), parameters);
    }

    private IngestResponse ingest(String ownerId,
                                  String title,
                                  String contentType,
                                  byte[] bytes,
                                  String text,
                                  ChunkingParameters parameters) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new InvalidParametersException("Owner id is required");
        }
        String fingerprint = Fingerprints.sha256(bytes);
        try {
            return ingestionLocks.withLock(ownerId, fingerprint,
                    () -> ingestLocked(ownerId, title, contentType, bytes.length, fingerprint, text, parameters));
        } catch (DataIntegrityViolationException e) {
            // Another instance stored the same content first.
            return documentRepository.findByOwnerIdAndContentHash(ownerId, fingerprint)
                    .map(this::deduplicated)
                    .orElseThrow(() -> e);
        }
    }

    private IngestResponse ingestLocked(String ownerId,
                                        String title,
                                        String contentType,
                                        long sizeBytes,
                                        String fingerprint,
                                        String text,
                                        ChunkingParameters parameters) {
        Optional<DocumentEntity> existing = documentRepository.findByOwnerIdAndContentHash(ownerId, fingerprint);
        if (existing.isPresent()) {
            return deduplicated(existing.get());
        }
        int maxDocuments = properties.getLimits().getMaxDocumentsPerUser();
        if (documentRepository.countByOwnerId(ownerId) >= maxDocuments) {
            rejectedCounter.increment();
            throw new QuotaExceededException("Document limit of " + maxDocuments + " reached");
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<Chunk> chunks = textChunker.chunk(text, parameters);
            if (chunks.isEmpty()) {
                throw new InvalidParametersException("No content chunks were produced for ingestion");
            }
            int maxChunks = properties.getLimits().getMaxChunksPerDocument();
            if (chunks.size() > maxChunks) {
                rejectedCounter.increment();
                throw new InvalidParametersException("Document produces " + chunks.size()
                        + " chunks, more than the limit of " + maxChunks);
            }
            List<float[]> vectors = embeddingsClient.embedMany(chunks.stream().map(Chunk::text).toList());
            DocumentEntity document = transactionTemplate.execute(status ->
                    store(ownerId, title, contentType, sizeBytes, fingerprint, parameters, chunks, vectors));
            acceptedCounter.increment();
            log.info("Ingested document {} for owner {} with {} chunks", document.getId(), ownerId, chunks.size());
            return new IngestResponse(document.getId(), document.getTitle(), document.getChunkCount(), sizeBytes, false);
        } finally {
            sample.stop(ingestionTimer);
        }
    }

    private DocumentEntity store(String ownerId,
                                 String title,
                                 String contentType,
                                 long sizeBytes,
                                 String fingerprint,
                                 ChunkingParameters parameters,
                                 List<Chunk> chunks,
                                 List<float[]> vectors) {
        DocumentEntity document = new DocumentEntity();
        document.setOwnerId(ownerId);
        document.setTitle(title);
        document.setContentType(contentType);
        document.setContentHash(fingerprint);
        document.setSizeBytes(sizeBytes);
        document.setChunkCount(chunks.size());
        document.setChunkSize(parameters.targetSize());
        document.setChunkOverlap(parameters.overlap());
        DocumentEntity saved = documentRepository.saveAndFlush(document);
        long documentId = saved.getId();

        List<DocumentChunkEntity> chunkEntities = new ArrayList<>(chunks.size());
        List<EmbeddedVector> embedded = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            String chunkId = chunk.idFor(documentId);
            chunkEntities.add(new DocumentChunkEntity(chunkId, documentId, ownerId, chunk.index(), chunk.text(),
                    chunk.fingerprint(), chunk.startOffset(), chunk.endOffset(), chunk.targetSize(), chunk.overlap()));
            embedded.add(new EmbeddedVector(chunkId, vectors.get(i), new VectorMetadata(documentId, chunk.index())));
        }
        chunkRepository.saveAll(chunkEntities);
        try {
            vectorIndex.addAll(ownerId, embedded);
        } catch (RuntimeException e) {
            removePartialVectors(ownerId, documentId, e);
            throw e;
        }
        return saved;
    }

    private void removePartialVectors(String ownerId, long documentId, RuntimeException cause) {
        try {
            vectorIndex.deleteDocument(ownerId, documentId);
        } catch (RuntimeException cleanupFailure) {
            log.warn("Could not remove partial vectors of document {} for owner {}", documentId, ownerId, cleanupFailure);
            cause.addSuppressed(cleanupFailure);
        }
    }

    private IngestResponse deduplicated(DocumentEntity document) {
        dedupCounter.increment();
        log.info("Skipped re-ingestion of document {} for owner {} due to matching content hash",
                document.getId(), document.getOwnerId());
        return new IngestResponse(document.getId(), document.getTitle(), document.getChunkCount(), document.getSizeBytes(), true);
    }

    private ChunkingParameters chunkingParameters(Integer chunkSize, Integer overlap) {
        RagProperties.Chunking defaults = properties.getChunking();
        int size = chunkSize == null ? defaults.getSize() : chunkSize;
        int resolvedOverlap = overlap == null ? Math.min(defaults.getOverlap(), Math.max(size - 1, 0)) : overlap;
        return new ChunkingParameters(size, resolvedOverlap);
    }
}
