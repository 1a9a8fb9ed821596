package com.mergeline.backend.staging;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One attempt at landing a list of batches on a target branch.
 * <p>
 * {@code heads} are the commits CI runs on, {@code commits} the ones the
 * branches are actually moved to. They only differ when a head carries a
 * uniquifier commit on top of the merge result.
 */
@Entity
@Table(name = "stagings")
public class StagingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staging_batches", joinColumns = @JoinColumn(name = "staging_id"))
    @OrderColumn(name = "position")
    @Column(name = "batch_id", nullable = false)
    private List<Long> batchIds = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staging_heads", joinColumns = @JoinColumn(name = "staging_id"))
    @OrderColumn(name = "position")
    private List<StagedCommit> heads = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "staging_commits", joinColumns = @JoinColumn(name = "staging_id"))
    @OrderColumn(name = "position")
    private List<StagedCommit> commits = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private StagingState state = StagingState.PENDING;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "staged_at", nullable = false)
    private Instant stagedAt;

    @Column(name = "timeout_limit", nullable = false)
    private Instant timeoutLimit;

    @Column(columnDefinition = "text")
    private String reason;

    // rendered statuses, written once when the staging leaves pending
    @Column(name = "statuses_cache", columnDefinition = "text")
    private String statusesCache;

    protected StagingEntity() {}

    public StagingEntity(Long targetId, List<Long> batchIds, List<StagedCommit> heads, List<StagedCommit> commits,
                         Instant stagedAt, Instant timeoutLimit) {
        this.targetId = targetId;
        this.batchIds = new ArrayList<>(batchIds);
        this.heads = new ArrayList<>(heads);
        this.commits = new ArrayList<>(commits);
        this.stagedAt = stagedAt;
        this.timeoutLimit = timeoutLimit;
    }

    public Long getId() { return id; }
    public Long getTargetId() { return targetId; }

    public List<Long> getBatchIds() { return List.copyOf(batchIds); }
    public List<StagedCommit> getHeads() { return List.copyOf(heads); }
    public List<StagedCommit> getCommits() { return List.copyOf(commits); }

    public StagingState getState() { return state; }
    void setState(StagingState state) { this.state = state; }

    public boolean isActive() { return active; }
    void setActive(boolean active) { this.active = active; }

    public Instant getStagedAt() { return stagedAt; }

    public Instant getTimeoutLimit() { return timeoutLimit; }
    void setTimeoutLimit(Instant timeoutLimit) { this.timeoutLimit = timeoutLimit; }

    public String getReason() { return reason; }
    void setReason(String reason) { this.reason = reason; }

    public String getStatusesCache() { return statusesCache; }

    void freezeStatuses(String json) {
        if (statusesCache == null) statusesCache = json;
    }

    public boolean isTimedOut(Instant now) {
        return timeoutLimit.isBefore(now);
    }

    public String displayName() {
        return id + " (" + state.code() + (reason == null ? "" : ", " + reason) + ")";
    }
}
