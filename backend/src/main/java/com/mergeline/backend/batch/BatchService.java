package com.mergeline.backend.batch;

import com.mergeline.backend.config.MergelineProperties;
import com.mergeline.backend.pr.PullRequestRepository;
import com.mergeline.backend.staging.SplitRepository;
import com.mergeline.backend.staging.StagingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.regex.Pattern;

@Service
public class BatchService {

    private static final Logger log = LoggerFactory.getLogger(BatchService.class);

    private final BatchRepository batches;
    private final PullRequestRepository prs;
    private final StagingRepository stagings;
    private final SplitRepository splits;
    private final Pattern noGroup;

    public BatchService(
            BatchRepository batches,
            PullRequestRepository prs,
            StagingRepository stagings,
            SplitRepository splits,
            MergelineProperties props
    ) {
        this.batches = batches;
        this.prs = prs;
        this.stagings = stagings;
        this.splits = splits;
        this.noGroup = Pattern.compile(props.getNoGroupPattern());
    }

    /**
     * The active batch for {@code (target, label)}, created if needed. Labels
     * matching the no-grouping pattern always get a batch of their own.
     */
    @Transactional
    public BatchEntity getOrCreate(Long targetId, String label) {
        if (label != null && noGroup.matcher(label).find()) {
            return batches.save(new BatchEntity(targetId));
        }

        List<BatchEntity> found = batches.findActiveByTargetAndLabel(targetId, label);
        if (found.size() > 1) {
            throw new IllegalStateException(
                    "found " + found.size() + " active batches for " + label + " on branch " + targetId);
        }
        if (!found.isEmpty()) return found.get(0);
        return batches.save(new BatchEntity(targetId));
    }

    /**
     * Deletes a batch which lost its last member, unless it is merged or a
     * staging or split still points at it.
     */
    @Transactional
    public boolean deleteIfOrphaned(Long batchId) {
        if (batchId == null) return false;
        BatchEntity batch = batches.findById(batchId).orElse(null);
        if (batch == null || batch.isMerged()) return false;
        if (prs.countByBatchId(batchId) > 0) return false;
        if (stagings.countReferencing(batchId) > 0 || splits.countReferencing(batchId) > 0) return false;

        log.debug("Deleting empty batch {}", batchId);
        batches.delete(batch);
        return true;
    }
}
