package com.mergeline.backend.acl;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ReviewRightRepository extends JpaRepository<ReviewRightEntity, Long> {

    long countByPartnerIdAndRepositoryIdAndReviewTrue(Long partnerId, Long repositoryId);

    long countByPartnerIdAndRepositoryIdAndSelfReviewTrue(Long partnerId, Long repositoryId);
}
