package com.mergeline.backend.batch;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Pull requests sharing a (target, label) pair, staged and merged as one unit.
 * Members point at their batch through {@code PullRequestEntity.batchId}.
 */
@Entity
@Table(name = "batches")
public class BatchEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    @Column(nullable = false)
    private boolean skipchecks;

    @Column(name = "cancel_staging", nullable = false)
    private boolean cancelStaging;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private BatchPriority priority = BatchPriority.DEFAULT;

    @Enumerated(EnumType.STRING)
    @Column(name = "fw_policy", nullable = false)
    private ForwardPortPolicy fwPolicy = ForwardPortPolicy.DEFAULT;

    // written once, when the staging containing this batch is merged
    @Column(name = "merge_date")
    private Instant mergeDate;

    protected BatchEntity() {}

    public BatchEntity(Long targetId) {
        this.targetId = targetId;
    }

    public Long getId() { return id; }

    public Long getTargetId() { return targetId; }

    public boolean isSkipchecks() { return skipchecks; }
    public void setSkipchecks(boolean skipchecks) { this.skipchecks = skipchecks; }

    public boolean isCancelStaging() { return cancelStaging; }
    public void setCancelStaging(boolean cancelStaging) { this.cancelStaging = cancelStaging; }

    public BatchPriority getPriority() { return priority; }
    public void setPriority(BatchPriority priority) { this.priority = priority; }

    public ForwardPortPolicy getFwPolicy() { return fwPolicy; }
    public void setFwPolicy(ForwardPortPolicy fwPolicy) { this.fwPolicy = fwPolicy; }

    public Instant getMergeDate() { return mergeDate; }

    public boolean isMerged() { return mergeDate != null; }

    public void markMerged(Instant when) {
        if (mergeDate != null) {
            throw new IllegalStateException("batch " + id + " already merged at " + mergeDate);
        }
        this.mergeDate = when;
    }
}
