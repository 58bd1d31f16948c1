package com.netcourier.docqa.persistence.repository;

import com.netcourier.docqa.persistence.entity.QueryLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.List;

public interface QueryLogRepository extends JpaRepository<QueryLogEntity, Long> {

    List<QueryLogEntity> findByOwnerIdOrderByCreatedAtDescIdDesc(String ownerId, Pageable pageable);

    long countByOwnerIdAndCreatedAtAfter(String ownerId, OffsetDateTime since);

    @Modifying
    @Transactional
    @Query("delete from QueryLogEntity q where q.ownerId = :ownerId")
    int deleteByOwner(@Param("ownerId") String ownerId);
}
