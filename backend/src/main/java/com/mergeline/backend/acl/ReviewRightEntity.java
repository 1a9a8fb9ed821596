package com.mergeline.backend.acl;

import jakarta.persistence.*;

@Entity
@Table(name = "review_rights")
public class ReviewRightEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "partner_id", nullable = false)
    private Long partnerId;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    @Column(nullable = false)
    private boolean review;

    @Column(name = "self_review", nullable = false)
    private boolean selfReview;

    protected ReviewRightEntity() {}

    public ReviewRightEntity(Long partnerId, Long repositoryId, boolean review, boolean selfReview) {
        this.partnerId = partnerId;
        this.repositoryId = repositoryId;
        this.review = review;
        this.selfReview = selfReview;
    }

    public Long getId() { return id; }
    public Long getPartnerId() { return partnerId; }
    public Long getRepositoryId() { return repositoryId; }

    public boolean isReview() { return review; }
    public void setReview(boolean review) { this.review = review; }

    public boolean isSelfReview() { return selfReview; }
    public void setSelfReview(boolean selfReview) { this.selfReview = selfReview; }
}
