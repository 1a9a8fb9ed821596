package com.mergeline.backend.outbox;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FeedbackRepository extends JpaRepository<FeedbackEntity, Long> {

    List<FeedbackEntity> findByRepositoryIdAndPullRequestOrderById(Long repositoryId, int pullRequest);
}
