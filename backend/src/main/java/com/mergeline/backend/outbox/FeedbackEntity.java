package com.mergeline.backend.outbox;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Queued comment (and optionally close) for a remote pull request. Keyed by
 * number rather than id so feedback survives the local PR being dropped.
 */
@Entity
@Table(name = "feedback")
public class FeedbackEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    @Column(name = "pr_number", nullable = false)
    private int pullRequest;

    @Column(columnDefinition = "text")
    private String message;

    @Column(name = "close_pr", nullable = false)
    private boolean close;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected FeedbackEntity() {}

    public FeedbackEntity(Long repositoryId, int pullRequest, String message, boolean close) {
        this.repositoryId = repositoryId;
        this.pullRequest = pullRequest;
        this.message = message;
        this.close = close;
    }

    @PrePersist
    public void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public Long getRepositoryId() { return repositoryId; }
    public int getPullRequest() { return pullRequest; }
    public String getMessage() { return message; }
    public boolean isClose() { return close; }
    public Instant getCreatedAt() { return createdAt; }
}
