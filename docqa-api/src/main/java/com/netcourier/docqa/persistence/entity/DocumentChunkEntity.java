package com.netcourier.docqa.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "document_chunks", indexes = {
        @Index(name = "idx_chunks_owner", columnList = "owner_id"),
        @Index(name = "idx_chunks_document", columnList = "document_id")
})
public class DocumentChunkEntity {

    @Id
    @Column(name = "chunk_id", length = 64)
    private String chunkId;

    @Column(name = "document_id", nullable = false)
    private Long documentId;

    @Column(name = "owner_id", nullable = false, length = 128)
    private String ownerId;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "start_offset", nullable = false)
    private int startOffset;

    @Column(name = "end_offset", nullable = false)
    private int endOffset;

    @Column(name = "target_size", nullable = false)
    private int targetSize;

    @Column(name = "overlap_size", nullable = false)
    private int overlap;

    protected DocumentChunkEntity() {
    }

    public DocumentChunkEntity(String chunkId,
                               Long documentId,
                               String ownerId,
                               int chunkIndex,
                               String content,
                               String contentHash,
                               int startOffset,
                               int endOffset,
                               int targetSize,
                               int overlap) {
        this.chunkId = chunkId;
        this.documentId = documentId;
        this.ownerId = ownerId;
        this.chunkIndex = chunkIndex;
        this.content = content;
        this.contentHash = contentHash;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.targetSize = targetSize;
        this.overlap = overlap;
    }

    public String getChunkId() {
        return chunkId;
    }

    public Long getDocumentId() {
        return documentId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public String getContent() {
        return content;
    }

    public String getContentHash() {
        return contentHash;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getTargetSize() {
        return targetSize;
    }

    public int getOverlap() {
        return overlap;
    }
}
