package com.netcourier.docqa.persistence.repository;

import com.netcourier.docqa.persistence.entity.DocumentChunkEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

public interface DocumentChunkRepository extends JpaRepository<DocumentChunkEntity, String> {

    List<DocumentChunkEntity> findByOwnerIdAndChunkIdIn(String ownerId, Collection<String> chunkIds);

    List<DocumentChunkEntity> findByOwnerIdOrderByDocumentIdAscChunkIndexAsc(String ownerId);

    long countByDocumentId(Long documentId);

    @Modifying
    @Transactional
    @Query("delete from DocumentChunkEntity c where c.ownerId = :ownerId and c.documentId = :documentId")
    int deleteByDocument(@Param("ownerId") String ownerId, @Param("documentId") Long documentId);

    @Modifying
    @Transactional
    @Query("delete from DocumentChunkEntity c where c.ownerId = :ownerId")
    int deleteByOwner(@Param("ownerId") String ownerId);
}
