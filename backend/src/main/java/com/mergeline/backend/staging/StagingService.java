package com.mergeline.backend.staging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mergeline.backend.batch.BatchEntity;
import com.mergeline.backend.batch.BatchRepository;
import com.mergeline.backend.commit.CommitService;
import com.mergeline.backend.commit.CommitStatus;
import com.mergeline.backend.config.MergelineProperties;
import com.mergeline.backend.outbox.FeedbackTemplate;
import com.mergeline.backend.outbox.Outbox;
import com.mergeline.backend.pr.DerivedStateRecomputer;
import com.mergeline.backend.pr.PullRequestEntity;
import com.mergeline.backend.pr.PullRequestMentions;
import com.mergeline.backend.pr.PullRequestRepository;
import com.mergeline.backend.pr.PullRequestTags;
import com.mergeline.backend.pr.StatusAggregation;
import com.mergeline.backend.registry.BranchEntity;
import com.mergeline.backend.registry.BranchRepository;
import com.mergeline.backend.registry.RepositoryEntity;
import com.mergeline.backend.registry.RepositoryRepository;
import com.mergeline.backend.registry.RequiredContexts;
import com.mergeline.backend.remote.FastForwardException;
import com.mergeline.backend.remote.RemoteRepositories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lifecycle of a staging once it has been created: CI aggregation, merge on
 * success, split or failure attribution otherwise.
 */
@Service
public class StagingService {

    private static final Logger log = LoggerFactory.getLogger(StagingService.class);

    private final StagingRepository stagings;
    private final SplitRepository splits;
    private final BatchRepository batches;
    private final PullRequestRepository prs;
    private final BranchRepository branches;
    private final RepositoryRepository repositories;
    private final CommitService commits;
    private final RequiredContexts requiredContexts;
    private final Outbox outbox;
    private final DerivedStateRecomputer recomputer;
    private final PullRequestMentions mentions;
    private final RemoteRepositories remotes;
    private final MergelineProperties props;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final FastForwardProtocol fastForward;

    public StagingService(
            StagingRepository stagings,
            SplitRepository splits,
            BatchRepository batches,
            PullRequestRepository prs,
            BranchRepository branches,
            RepositoryRepository repositories,
            CommitService commits,
            RequiredContexts requiredContexts,
            Outbox outbox,
            DerivedStateRecomputer recomputer,
            PullRequestMentions mentions,
            RemoteRepositories remotes,
            MergelineProperties props,
            Clock clock,
            ObjectMapper mapper
    ) {
        this.stagings = stagings;
        this.splits = splits;
        this.batches = batches;
        this.prs = prs;
        this.branches = branches;
        this.repositories = repositories;
        this.commits = commits;
        this.requiredContexts = requiredContexts;
        this.outbox = outbox;
        this.recomputer = recomputer;
        this.mentions = mentions;
        this.remotes = remotes;
        this.props = props;
        this.clock = clock;
        this.mapper = mapper;
        this.fastForward = new FastForwardProtocol(
                props.getFastForward().getTmpPrefix(),
                props.getFastForward().getBackoff(),
                FastForwardProtocol.Sleeper.THREAD
        );
    }

    /**
     * Records a staging built by the scheduler. Batches are taken out of any
     * split they were waiting in.
     *
     * @param commits          commits the branches will be moved to, same as
     *                         {@code heads} when empty
     * @param integrationHeads per PR id, the commit the PR was integrated as
     */
    @Transactional
    public StagingEntity stage(Long targetId, List<Long> batchIds, List<StagedCommit> heads,
                               List<StagedCommit> commits, Map<Long, String> integrationHeads) {
        BranchEntity target = branches.findById(targetId)
                .orElseThrow(() -> new IllegalArgumentException("Branch not found: " + targetId));
        if (!target.isActive() || !target.isStagingEnabled()) {
            throw new IllegalStateException("staging is disabled on " + target.displayName());
        }
        if (batchIds.isEmpty()) throw new IllegalArgumentException("nothing to stage");
        if (heads.isEmpty()) throw new IllegalArgumentException("a staging needs at least one head");

        stagings.findFirstByTargetIdAndActiveTrue(targetId).ifPresent(s -> {
            throw new IllegalStateException("branch " + target.getName() + " already has active staging " + s.getId());
        });

        for (Long batchId : batchIds) {
            BatchEntity b = batches.findById(batchId)
                    .orElseThrow(() -> new IllegalArgumentException("Batch not found: " + batchId));
            if (!Objects.equals(b.getTargetId(), targetId)) {
                throw new IllegalStateException("batch " + batchId + " does not target " + target.getName());
            }
            if (b.isMerged()) throw new IllegalStateException("batch " + batchId + " is already merged");

            for (SplitEntity split : splits.findContainingBatch(batchId)) {
                split.removeBatch(batchId);
                if (split.isEmpty()) splits.delete(split);
            }
        }

        Instant now = clock.instant();
        StagingEntity staging = stagings.save(new StagingEntity(
                targetId, batchIds, heads, commits.isEmpty() ? heads : commits,
                now, now.plus(props.getCiTimeout())
        ));

        for (PullRequestEntity pr : prs.findByBatchIdInOrderById(batchIds)) {
            String integration = integrationHeads.get(pr.getId());
            if (integration != null) pr.setIntegrationHead(integration);
            outbox.changeTags(pr.getRepositoryId(), pr.getNumber(), PullRequestTags.ALL, PullRequestTags.staged());
        }

        log.info("Staged {} on {}: batches {}, heads {}", staging.getId(), target.getName(), batchIds, heads);
        validate(staging);
        return staging;
    }

    @Transactional
    public void validate(Long stagingId) {
        validate(require(stagingId));
    }

    void validate(StagingEntity staging) {
        if (staging.getState() != StagingState.PENDING) return;

        BranchEntity target = targetOf(staging);
        List<StagingValidator.HeadStatuses> heads = new ArrayList<>();
        for (StagedCommit head : staging.getHeads()) {
            heads.add(new StagingValidator.HeadStatuses(
                    commits.statusesOf(head.getSha()),
                    requiredContexts.forStaging(head.getRepositoryId(), target)
            ));
        }

        StagingValidator.Verdict verdict = StagingValidator.validate(heads);
        if (verdict.rearm()) {
            Instant limit = clock.instant().plus(props.getCiTimeout());
            staging.setTimeoutLimit(limit);
            log.debug("Staging {} got pending status, bumping timeout to {}", staging.getId(), limit);
        }
        transition(staging, verdict.state());
    }

    @Transactional(readOnly = true)
    public List<RenderedStatus> statuses(Long stagingId) {
        return statuses(require(stagingId));
    }

    List<RenderedStatus> statuses(StagingEntity staging) {
        if (staging.getStatusesCache() != null) {
            try {
                return mapper.readValue(staging.getStatusesCache(), new TypeReference<List<RenderedStatus>>() {});
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Unreadable statuses of staging " + staging.getId(), e);
            }
        }

        List<RenderedStatus> out = new ArrayList<>();
        for (StagedCommit head : staging.getHeads()) {
            String repo = repositoryName(head.getRepositoryId());
            for (Map.Entry<String, CommitStatus> e : commits.statusesOf(head.getSha()).entrySet()) {
                CommitStatus st = e.getValue();
                out.add(new RenderedStatus(repo, e.getKey(), st.state().wireName(),
                        st.targetUrl() == null ? "" : st.targetUrl()));
            }
        }
        return out;
    }

    @Transactional
    public boolean cancel(Long stagingId, String reason) {
        return cancel(require(stagingId), reason);
    }

    /**
     * @return false if the staging was already inactive
     */
    public boolean cancel(StagingEntity staging, String reason) {
        if (!staging.isActive()) return false;

        log.info("Cancelling staging {}: {}", staging.getId(), reason);
        transition(staging, StagingState.CANCELLED);
        staging.setActive(false);
        staging.setReason(reason);
        restoreTags(staging, Set.of());
        return true;
    }

    /**
     * Marks the PRs (every member when none is given) as errored, notifies
     * them and deactivates the staging.
     */
    public void fail(StagingEntity staging, String message, List<PullRequestEntity> culprits) {
        log.info("Staging {} failed: {}", staging.getId(), message);

        List<PullRequestEntity> targets = culprits == null || culprits.isEmpty() ? members(staging) : culprits;
        Set<Long> ids = new HashSet<>();
        for (PullRequestEntity pr : targets) {
            pr.setError(true);
            ids.add(pr.getId());
            outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.STAGING_FAILED, mentions.ping(pr), message);
        }

        transition(staging, StagingState.FAILURE);
        staging.setActive(false);
        staging.setReason(message);

        recomputer.refresh(ids);
        restoreTags(staging, ids);
    }

    /**
     * Splits a multi-batch staging in two halves, or blames the single batch.
     *
     * @return true if the staging was split
     */
    public boolean trySplitting(StagingEntity staging) {
        List<Long> batchIds = staging.getBatchIds();
        if (batchIds.size() > 1) {
            int midpoint = batchIds.size() / 2;
            SplitEntity head = splits.save(new SplitEntity(staging.getTargetId(), batchIds.subList(0, midpoint)));
            SplitEntity tail = splits.save(new SplitEntity(staging.getTargetId(), batchIds.subList(midpoint, batchIds.size())));
            log.info("Split {} to {} ({}) and {} ({})", staging.getId(),
                    head.getBatchIds(), head.getId(), tail.getBatchIds(), tail.getId());

            String reason = staging.getState() == StagingState.FAILURE ? staging.getReason() : "timed out";
            transition(staging, StagingState.FAILURE);
            staging.setActive(false);
            staging.setReason(reason);
            restoreTags(staging, Set.of());
            return true;
        }

        if (staging.getState() != StagingState.FAILURE) {
            fail(staging, "timed out (>" + props.getCiTimeout().toMinutes() + " minutes)", null);
            return false;
        }

        BranchEntity target = targetOf(staging);
        for (StagedCommit head : staging.getHeads()) {
            List<String> required = requiredContexts.forStaging(head.getRepositoryId(), target);
            Map<String, CommitStatus> statuses = commits.statusesOf(head.getSha());
            String context = StatusAggregation.firstFailing(statuses, required);
            if (context == null) continue;

            CommitStatus status = statuses.get(context);
            String viewMore = status.targetUrl() == null ? "" : " (view more at " + status.targetUrl() + ")";
            PullRequestEntity culprit = members(staging).stream()
                    .filter(pr -> Objects.equals(pr.getRepositoryId(), head.getRepositoryId()))
                    .findFirst()
                    .orElse(null);
            if (culprit != null) {
                fail(staging, context + viewMore, List.of(culprit));
            } else {
                fail(staging, context + " on " + head.getSha() + viewMore, null);
            }
            return false;
        }

        fail(staging, "unknown reason", null);
        return false;
    }

    /**
     * Merges a successful staging, splits a failed or timed out one, leaves
     * a pending one alone.
     */
    @Transactional
    public void checkStatus(Long stagingId) {
        StagingEntity staging = require(stagingId);
        if (!staging.isActive()) {
            log.info("Staging {} is not active, ignoring status check", staging.getId());
            return;
        }

        log.info("Checking active staging {} (state={})", staging.getId(), staging.getState().code());
        if (staging.getState() == StagingState.SUCCESS) {
            merge(staging);
        } else if (staging.getState() == StagingState.FAILURE || staging.isTimedOut(clock.instant())) {
            trySplitting(staging);
        }
    }

    private void merge(StagingEntity staging) {
        BranchEntity target = targetOf(staging);
        List<Long> memberIds = members(staging).stream().map(PullRequestEntity::getId).toList();
        List<PullRequestEntity> locked = memberIds.isEmpty() ? List.of() : prs.lockAll(memberIds);

        List<FastForwardProtocol.Target> targets = new ArrayList<>();
        for (StagedCommit c : staging.getCommits()) {
            targets.add(new FastForwardProtocol.Target(remotes.forRepository(repositoryName(c.getRepositoryId())), c.getSha()));
        }

        try {
            fastForward.run(target.getName(), targets);
            merged(staging, locked);
        } catch (FastForwardException e) {
            log.warn("Could not fast-forward successful staging on {}:{}", e.getRepository(), target.getName(), e);
            transition(staging, StagingState.FF_FAILED);
            staging.setReason(e.getRepository() + ": " + e.getMessage());
        } finally {
            staging.setActive(false);
        }
    }

    private void merged(StagingEntity staging, List<PullRequestEntity> members) {
        log.info("Staging {} fast-forwarded, marking {} PR(s) as merged", staging.getId(), members.size());
        Instant now = clock.instant();
        for (BatchEntity b : batches.findAllById(staging.getBatchIds())) {
            b.markMerged(now);
        }
        recomputer.refresh(members.stream().map(PullRequestEntity::getId).toList());

        for (PullRequestEntity pr : members) {
            String sha = pr.getIntegrationHead() != null ? pr.getIntegrationHead() : commitFor(staging, pr.getRepositoryId());
            outbox.close(pr.getRepositoryId(), pr.getNumber(), json(Map.of("sha", sha == null ? "" : sha)));
        }
    }

    private void transition(StagingEntity staging, StagingState state) {
        boolean wasPending = staging.getState() == StagingState.PENDING;
        if (wasPending && state != StagingState.PENDING) {
            // freeze before leaving pending, commit statuses keep changing afterwards
            staging.freezeStatuses(json(statuses(staging)));
        }
        staging.setState(state);
    }

    private void restoreTags(StagingEntity staging, Set<Long> skip) {
        for (PullRequestEntity pr : members(staging)) {
            if (skip.contains(pr.getId()) || pr.getState().isTerminal()) continue;
            outbox.changeTags(pr.getRepositoryId(), pr.getNumber(), PullRequestTags.ALL, PullRequestTags.forState(pr.getState()));
        }
    }

    private List<PullRequestEntity> members(StagingEntity staging) {
        List<Long> batchIds = staging.getBatchIds();
        return batchIds.isEmpty() ? List.of() : prs.findByBatchIdInOrderById(batchIds);
    }

    private String commitFor(StagingEntity staging, Long repositoryId) {
        return staging.getCommits().stream()
                .filter(c -> Objects.equals(c.getRepositoryId(), repositoryId))
                .map(StagedCommit::getSha)
                .findFirst()
                .orElse(null);
    }

    private StagingEntity require(Long stagingId) {
        return stagings.findById(stagingId)
                .orElseThrow(() -> new IllegalArgumentException("Staging not found: " + stagingId));
    }

    private BranchEntity targetOf(StagingEntity staging) {
        return branches.findById(staging.getTargetId())
                .orElseThrow(() -> new IllegalArgumentException("Branch not found: " + staging.getTargetId()));
    }

    private String repositoryName(Long repositoryId) {
        return repositories.findById(repositoryId)
                .map(RepositoryEntity::getName)
                .orElseThrow(() -> new IllegalArgumentException("Repository not found: " + repositoryId));
    }

    private String json(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value, e);
        }
    }
}
