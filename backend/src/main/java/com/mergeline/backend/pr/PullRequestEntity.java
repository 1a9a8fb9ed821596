package com.mergeline.backend.pr;

import com.mergeline.backend.commit.CommitStatus;
import com.mergeline.backend.commit.StatusMapConverter;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

@Entity
@Table(
        name = "pull_requests",
        uniqueConstraints = @UniqueConstraint(columnNames = {"repository_id", "pr_number"})
)
public class PullRequestEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    @Column(name = "repository_name", nullable = false)
    private String repositoryName;

    @Column(name = "pr_number", nullable = false)
    private int number;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    // owner:branch of the source, shared by sibling PRs across repositories
    @Column(nullable = false)
    private String label;

    @Column(name = "head_sha", nullable = false, length = 64)
    private String head;

    @Column(columnDefinition = "text")
    private String message;

    @Column(nullable = false)
    private boolean draft;

    @Column(nullable = false)
    private boolean squash;

    @Enumerated(EnumType.STRING)
    @Column(name = "merge_method")
    private MergeMethod mergeMethod;

    @Column(name = "method_warned", nullable = false)
    private boolean methodWarned;

    @Column(name = "link_warned", nullable = false)
    private boolean linkWarned;

    @Column(name = "author_id")
    private Long authorId;

    @Column(name = "reviewed_by_id")
    private Long reviewedById;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "pull_request_delegates", joinColumns = @JoinColumn(name = "pull_request_id"))
    @Column(name = "partner_id")
    private Set<Long> delegateIds = new HashSet<>();

    @Column(nullable = false)
    private boolean closed;

    @Column(name = "in_error", nullable = false)
    private boolean error;

    @Convert(converter = StatusMapConverter.class)
    @Column(nullable = false, columnDefinition = "text")
    private Map<String, CommitStatus> overrides = new LinkedHashMap<>();

    // copy of the head commit's statuses, frozen once merged
    @Convert(converter = StatusMapConverter.class)
    @Column(nullable = false, columnDefinition = "text")
    private Map<String, CommitStatus> statuses = new LinkedHashMap<>();

    @Convert(converter = StatusMapConverter.class)
    @Column(name = "previous_failures", nullable = false, columnDefinition = "text")
    private Map<String, CommitStatus> previousFailures = new LinkedHashMap<>();

    // derived, maintained by DerivedStateRecomputer
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AggregateStatus status = AggregateStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PullRequestState state = PullRequestState.OPENED;

    private String blocked;

    @Column(name = "batch_id")
    private Long batchId;

    // forward-port links
    @Column(name = "parent_id")
    private Long parentId;

    @Column(name = "source_id")
    private Long sourceId;

    @Column(name = "limit_branch_id")
    private Long limitBranchId;

    @Column(name = "detach_reason")
    private String detachReason;

    // commit actually integrated by the staging, reported when merged
    @Column(name = "integration_head", length = 64)
    private String integrationHead;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected PullRequestEntity() {}

    public PullRequestEntity(Long repositoryId, String repositoryName, int number, Long targetId, String label, String head) {
        this.repositoryId = repositoryId;
        this.repositoryName = repositoryName;
        this.number = number;
        this.targetId = targetId;
        this.label = label;
        this.head = head;
    }

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public Long getRepositoryId() { return repositoryId; }
    public String getRepositoryName() { return repositoryName; }
    public int getNumber() { return number; }

    public Long getTargetId() { return targetId; }
    public void setTargetId(Long targetId) { this.targetId = targetId; }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public String getHead() { return head; }
    public void setHead(String head) { this.head = head; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public boolean isDraft() { return draft; }
    public void setDraft(boolean draft) { this.draft = draft; }

    public boolean isSquash() { return squash; }
    public void setSquash(boolean squash) {
        this.squash = squash;
        if (squash) this.mergeMethod = null;
    }

    public MergeMethod getMergeMethod() { return mergeMethod; }
    public void setMergeMethod(MergeMethod mergeMethod) { this.mergeMethod = mergeMethod; }

    public boolean hasMergeMethod() {
        return squash || mergeMethod != null;
    }

    public boolean isMethodWarned() { return methodWarned; }
    public void setMethodWarned(boolean methodWarned) { this.methodWarned = methodWarned; }

    public boolean isLinkWarned() { return linkWarned; }
    public void setLinkWarned(boolean linkWarned) { this.linkWarned = linkWarned; }

    public Long getAuthorId() { return authorId; }
    public void setAuthorId(Long authorId) { this.authorId = authorId; }

    public Long getReviewedById() { return reviewedById; }
    public void setReviewedById(Long reviewedById) { this.reviewedById = reviewedById; }

    public boolean isReviewed() {
        return reviewedById != null;
    }

    public Set<Long> getDelegateIds() {
        return Collections.unmodifiableSet(delegateIds);
    }

    public void addDelegate(Long partnerId) {
        delegateIds.add(partnerId);
    }

    public boolean isClosed() { return closed; }
    public void setClosed(boolean closed) { this.closed = closed; }

    public boolean isError() { return error; }
    public void setError(boolean error) { this.error = error; }

    public Map<String, CommitStatus> getOverrides() {
        return Collections.unmodifiableMap(overrides);
    }

    public void putOverride(String context, CommitStatus status) {
        Map<String, CommitStatus> next = new LinkedHashMap<>(overrides);
        next.put(context, status);
        this.overrides = next;
    }

    public Map<String, CommitStatus> getStatuses() {
        return Collections.unmodifiableMap(statuses);
    }

    public void setStatuses(Map<String, CommitStatus> statuses) {
        this.statuses = new LinkedHashMap<>(statuses);
    }

    public Map<String, CommitStatus> getPreviousFailures() {
        return Collections.unmodifiableMap(previousFailures);
    }

    public void recordFailure(String context, CommitStatus status) {
        Map<String, CommitStatus> next = new LinkedHashMap<>(previousFailures);
        next.put(context, status);
        this.previousFailures = next;
    }

    public AggregateStatus getStatus() { return status; }
    void setStatus(AggregateStatus status) { this.status = status; }

    public PullRequestState getState() { return state; }
    void setState(PullRequestState state) { this.state = state; }

    public String getBlocked() { return blocked; }
    void setBlocked(String blocked) { this.blocked = blocked; }

    public Long getBatchId() { return batchId; }
    public void setBatchId(Long batchId) { this.batchId = batchId; }

    public Long getParentId() { return parentId; }
    public void setParentId(Long parentId) { this.parentId = parentId; }

    public Long getSourceId() { return sourceId; }
    public void setSourceId(Long sourceId) { this.sourceId = sourceId; }

    public Long getLimitBranchId() { return limitBranchId; }
    public void setLimitBranchId(Long limitBranchId) { this.limitBranchId = limitBranchId; }

    public String getDetachReason() { return detachReason; }
    public void setDetachReason(String detachReason) { this.detachReason = detachReason; }

    public String getIntegrationHead() { return integrationHead; }
    public void setIntegrationHead(String integrationHead) { this.integrationHead = integrationHead; }

    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public String displayName() {
        return repositoryName + "#" + number;
    }
}
