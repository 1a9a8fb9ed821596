package com.mergeline.backend.pr;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PullRequestRepository extends JpaRepository<PullRequestEntity, Long> {

    Optional<PullRequestEntity> findByRepositoryIdAndNumber(Long repositoryId, int number);

    List<PullRequestEntity> findByBatchIdOrderById(Long batchId);

    List<PullRequestEntity> findByBatchIdInOrderById(Collection<Long> batchIds);

    List<PullRequestEntity> findByHead(String head);

    List<PullRequestEntity> findByParentIdOrderById(Long parentId);

    List<PullRequestEntity> findByTargetIdAndStateNotIn(Long targetId, Collection<PullRequestState> states);

    List<PullRequestEntity> findByStateNotIn(Collection<PullRequestState> states);

    long countByBatchId(Long batchId);

    /**
     * Locks the PR unless another transaction holds it (most likely merging
     * it), in which case nothing is returned.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("select p from PullRequestEntity p where p.id = :id and p.state <> com.mergeline.backend.pr.PullRequestState.MERGED")
    Optional<PullRequestEntity> lockUnmergedSkipLocked(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PullRequestEntity p where p.id in :ids order by p.id")
    List<PullRequestEntity> lockAll(@Param("ids") Collection<Long> ids);
}
