package com.mergeline.backend.outbox;

import org.springframework.data.jpa.repository.JpaRepository;

public interface FetchJobRepository extends JpaRepository<FetchJobEntity, Long> {

    boolean existsByRepositoryIdAndPullRequestAndActiveTrue(Long repositoryId, int pullRequest);
}
