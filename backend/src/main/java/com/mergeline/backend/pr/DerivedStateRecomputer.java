package com.mergeline.backend.pr;

import com.mergeline.backend.batch.BatchEntity;
import com.mergeline.backend.batch.BatchRepository;
import com.mergeline.backend.commit.CommitStatus;
import com.mergeline.backend.outbox.Outbox;
import com.mergeline.backend.registry.BranchEntity;
import com.mergeline.backend.registry.BranchRepository;
import com.mergeline.backend.registry.RequiredContexts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recomputes the cached derived fields of pull requests (aggregate status,
 * state, blocked reason) after a mutation. Status and state are computed per
 * PR first, then blocked reasons for every batch touched, since those depend
 * on the states of all batch mates.
 */
@Service
public class DerivedStateRecomputer {

    private static final Logger log = LoggerFactory.getLogger(DerivedStateRecomputer.class);

    private final PullRequestRepository prs;
    private final BatchRepository batches;
    private final BranchRepository branches;
    private final RequiredContexts requiredContexts;
    private final Outbox outbox;

    public DerivedStateRecomputer(
            PullRequestRepository prs,
            BatchRepository batches,
            BranchRepository branches,
            RequiredContexts requiredContexts,
            Outbox outbox
    ) {
        this.prs = prs;
        this.batches = batches;
        this.branches = branches;
        this.requiredContexts = requiredContexts;
        this.outbox = outbox;
    }

    @Transactional
    public void refresh(Collection<Long> ids) {
        if (ids.isEmpty()) return;

        Set<Long> touchedBatches = new LinkedHashSet<>();
        for (PullRequestEntity pr : prs.findAllById(new LinkedHashSet<>(ids))) {
            recompute(pr);
            if (pr.getBatchId() != null) {
                touchedBatches.add(pr.getBatchId());
            } else {
                pr.setBlocked(null);
            }
        }
        for (Long batchId : touchedBatches) {
            refreshBlocked(batchId);
        }
    }

    @Transactional
    public void refresh(PullRequestEntity... pullRequests) {
        List<Long> ids = new ArrayList<>();
        for (PullRequestEntity pr : pullRequests) ids.add(pr.getId());
        refresh(ids);
    }

    /**
     * Overrides are inherited along the forward-port chain, so a change on
     * one PR must be reflected on every descendant.
     */
    @Transactional
    public void refreshWithDescendants(PullRequestEntity pr) {
        List<Long> ids = new ArrayList<>();
        ids.add(pr.getId());
        ids.addAll(descendantIds(pr.getId()));
        refresh(ids);
    }

    /**
     * For changes made at the batch level (skipchecks, merge date).
     */
    @Transactional
    public void refreshBatch(Long batchId) {
        refresh(prs.findByBatchIdOrderById(batchId).stream().map(PullRequestEntity::getId).toList());
    }

    public Map<String, CommitStatus> effectiveStatuses(PullRequestEntity pr) {
        List<Map<String, CommitStatus>> layers = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        PullRequestEntity current = pr;
        while (current != null && seen.add(current.getId())) {
            layers.add(current.getOverrides());
            current = current.getParentId() == null ? null : prs.findById(current.getParentId()).orElse(null);
        }
        Collections.reverse(layers);
        return StatusAggregation.effective(pr.getStatuses(), layers);
    }

    public List<String> requiredFor(PullRequestEntity pr) {
        BranchEntity target = branches.findById(pr.getTargetId())
                .orElseThrow(() -> new IllegalArgumentException("Branch not found: " + pr.getTargetId()));
        return requiredContexts.forPullRequest(pr.getRepositoryId(), target);
    }

    List<Long> descendantIds(Long id) {
        List<Long> out = new ArrayList<>();
        Set<Long> seen = new HashSet<>(Set.of(id));
        Deque<Long> queue = new ArrayDeque<>(List.of(id));
        while (!queue.isEmpty()) {
            for (PullRequestEntity child : prs.findByParentIdOrderById(queue.poll())) {
                if (seen.add(child.getId())) {
                    out.add(child.getId());
                    queue.add(child.getId());
                }
            }
        }
        return out;
    }

    private void recompute(PullRequestEntity pr) {
        BatchEntity batch = pr.getBatchId() == null ? null : batches.findById(pr.getBatchId()).orElse(null);

        pr.setStatus(StatusAggregation.aggregate(effectiveStatuses(pr), requiredFor(pr)));

        PullRequestState before = pr.getState();
        PullRequestState after = PullRequestStateMachine.state(pr, batch);
        if (before != after) {
            log.info("{}: {} -> {}", pr.displayName(), before, after);
            pr.setState(after);
            outbox.changeTags(pr.getRepositoryId(), pr.getNumber(), PullRequestTags.ALL, PullRequestTags.forState(after));
        }
    }

    private void refreshBlocked(Long batchId) {
        BatchEntity batch = batches.findById(batchId).orElse(null);
        List<PullRequestEntity> members = prs.findByBatchIdOrderById(batchId);
        for (PullRequestEntity m : members) {
            m.setBlocked(PullRequestStateMachine.blocked(m, batch, members));
        }
    }
}
