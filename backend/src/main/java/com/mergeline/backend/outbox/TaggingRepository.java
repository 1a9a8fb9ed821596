package com.mergeline.backend.outbox;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TaggingRepository extends JpaRepository<TaggingEntity, Long> {

    List<TaggingEntity> findByRepositoryIdAndPullRequestOrderById(Long repositoryId, int pullRequest);
}
