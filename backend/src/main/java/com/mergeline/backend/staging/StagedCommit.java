package com.mergeline.backend.staging;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.util.Objects;

/**
 * One repository's commit in a staging.
 */
@Embeddable
public class StagedCommit {

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    @Column(nullable = false, length = 64)
    private String sha;

    protected StagedCommit() {}

    public StagedCommit(Long repositoryId, String sha) {
        this.repositoryId = repositoryId;
        this.sha = sha;
    }

    public Long getRepositoryId() { return repositoryId; }
    public String getSha() { return sha; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StagedCommit other)) return false;
        return Objects.equals(repositoryId, other.repositoryId) && Objects.equals(sha, other.sha);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repositoryId, sha);
    }

    @Override
    public String toString() {
        return repositoryId + "@" + sha;
    }
}
