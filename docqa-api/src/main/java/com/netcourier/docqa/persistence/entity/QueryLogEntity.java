package com.netcourier.docqa.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;

@Entity
@Table(name = "query_logs", indexes = @Index(name = "idx_query_logs_owner_created", columnList = "owner_id, created_at"))
public class QueryLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false, length = 128)
    private String ownerId;

    @Column(name = "question", nullable = false, columnDefinition = "text")
    private String question;

    @Column(name = "answer", nullable = false, columnDefinition = "text")
    private String answer;

    @Column(name = "elapsed_millis", nullable = false)
    private long elapsedMillis;

    @Column(name = "chunks_used", nullable = false)
    private int chunksUsed;

    @Column(name = "chunk_ids", length = 4000)
    private String chunkIds;

    @Column(name = "backend", nullable = false, length = 64)
    private String backend;

    @Enumerated(EnumType.STRING)
    @Column(name = "delivery_mode", nullable = false, length = 16)
    private DeliveryMode mode;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    protected QueryLogEntity() {
    }

    public QueryLogEntity(String ownerId,
                          String question,
                          String answer,
                          long elapsedMillis,
                          List<String> chunkIds,
                          String backend,
                          DeliveryMode mode) {
        this.ownerId = ownerId;
        this.question = question;
        this.answer = answer;
        this.elapsedMillis = elapsedMillis;
        this.chunksUsed = chunkIds.size();
        this.chunkIds = String.join(",", chunkIds);
        this.backend = backend;
        this.mode = mode;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public Long getId() {
        return id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getQuestion() {
        return question;
    }

    public String getAnswer() {
        return answer;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    public int getChunksUsed() {
        return chunksUsed;
    }

    public List<String> getChunkIds() {
        if (chunkIds == null || chunkIds.isBlank()) {
            return List.of();
        }
        return Arrays.asList(chunkIds.split(","));
    }

    public String getBackend() {
        return backend;
    }

    public DeliveryMode getMode() {
        return mode;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
