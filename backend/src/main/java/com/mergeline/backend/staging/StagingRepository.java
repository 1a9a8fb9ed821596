package com.mergeline.backend.staging;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface StagingRepository extends JpaRepository<StagingEntity, Long> {

    Optional<StagingEntity> findFirstByTargetIdAndActiveTrue(Long targetId);

    List<StagingEntity> findByActiveTrueOrderById();

    @Query("select s from StagingEntity s where s.active = true and :batchId member of s.batchIds")
    List<StagingEntity> findActiveContainingBatch(@Param("batchId") Long batchId);

    @Query("""
        select distinct s
        from StagingEntity s join s.heads h
        where s.active = true
          and s.state = com.mergeline.backend.staging.StagingState.PENDING
          and h.sha = :sha
    """)
    List<StagingEntity> findPendingByHead(@Param("sha") String sha);

    @Query("select count(s) from StagingEntity s where :batchId member of s.batchIds")
    long countReferencing(@Param("batchId") Long batchId);
}
