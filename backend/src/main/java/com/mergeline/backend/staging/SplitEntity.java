package com.mergeline.backend.staging;

import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Half of a failed multi-batch staging, waiting to be staged on its own.
 */
@Entity
@Table(name = "splits")
public class SplitEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "target_id", nullable = false)
    private Long targetId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "split_batches", joinColumns = @JoinColumn(name = "split_id"))
    @OrderColumn(name = "position")
    @Column(name = "batch_id", nullable = false)
    private List<Long> batchIds = new ArrayList<>();

    protected SplitEntity() {}

    public SplitEntity(Long targetId, List<Long> batchIds) {
        this.targetId = targetId;
        this.batchIds = new ArrayList<>(batchIds);
    }

    public Long getId() { return id; }
    public Long getTargetId() { return targetId; }

    public List<Long> getBatchIds() { return List.copyOf(batchIds); }

    public boolean removeBatch(Long batchId) {
        return batchIds.remove(batchId);
    }

    public boolean isEmpty() {
        return batchIds.isEmpty();
    }
}
