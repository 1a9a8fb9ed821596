package com.mergeline.backend.staging;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface SplitRepository extends JpaRepository<SplitEntity, Long> {

    List<SplitEntity> findByTargetIdOrderById(Long targetId);

    @Query("select s from SplitEntity s where :batchId member of s.batchIds order by s.id")
    List<SplitEntity> findContainingBatch(@Param("batchId") Long batchId);

    @Query("select count(s) from SplitEntity s where :batchId member of s.batchIds")
    long countReferencing(@Param("batchId") Long batchId);
}
