package com.mergeline.backend.outbox;

import jakarta.persistence.*;

@Entity
@Table(name = "fetch_jobs")
public class FetchJobEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    @Column(name = "pr_number", nullable = false)
    private int pullRequest;

    @Column(nullable = false)
    private boolean closing;

    @Column(nullable = false)
    private boolean active = true;

    protected FetchJobEntity() {}

    public FetchJobEntity(Long repositoryId, int pullRequest, boolean closing) {
        this.repositoryId = repositoryId;
        this.pullRequest = pullRequest;
        this.closing = closing;
    }

    public Long getId() { return id; }
    public Long getRepositoryId() { return repositoryId; }
    public int getPullRequest() { return pullRequest; }
    public boolean isClosing() { return closing; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
}
