package com.mergeline.backend.batch;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface BatchRepository extends JpaRepository<BatchEntity, Long> {

    /**
     * Active (unmerged) batches of the target holding a PR with this label.
     */
    @Query("""
        select distinct b
        from BatchEntity b, PullRequestEntity p
        where p.batchId = b.id
          and b.targetId = :targetId
          and b.mergeDate is null
          and p.label = :label
        order by b.id
    """)
    List<BatchEntity> findActiveByTargetAndLabel(@Param("targetId") Long targetId, @Param("label") String label);
}
