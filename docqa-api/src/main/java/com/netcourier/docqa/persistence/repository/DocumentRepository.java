package com.netcourier.docqa.persistence.repository;

import com.netcourier.docqa.persistence.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

public interface DocumentRepository extends JpaRepository<DocumentEntity, Long> {

    Optional<DocumentEntity> findByOwnerIdAndContentHash(String ownerId, String contentHash);

    Optional<DocumentEntity> findByIdAndOwnerId(Long id, String ownerId);

    List<DocumentEntity> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    long countByOwnerId(String ownerId);

    @Modifying
    @Transactional
    @Query("delete from DocumentEntity d where d.ownerId = :ownerId")
    int deleteByOwner(@Param("ownerId") String ownerId);
}
