package com.mergeline.backend.pr;

import com.mergeline.backend.acl.PartnerEntity;
import com.mergeline.backend.acl.PartnerRepository;
import com.mergeline.backend.batch.BatchService;
import com.mergeline.backend.commit.CommitService;
import com.mergeline.backend.commit.CommitStatus;
import com.mergeline.backend.config.MergelineProperties;
import com.mergeline.backend.outbox.FeedbackTemplate;
import com.mergeline.backend.outbox.Outbox;
import com.mergeline.backend.registry.BranchEntity;
import com.mergeline.backend.registry.BranchRepository;
import com.mergeline.backend.registry.RepositoryEntity;
import com.mergeline.backend.registry.RepositoryRepository;
import com.mergeline.backend.staging.SplitEntity;
import com.mergeline.backend.staging.SplitRepository;
import com.mergeline.backend.staging.StagingEntity;
import com.mergeline.backend.staging.StagingRepository;
import com.mergeline.backend.staging.StagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutations of pull requests coming from the remote: creation, pushes,
 * retargeting, closing. Every one keeps the batch membership consistent
 * with the PR's (target, label) and refreshes the derived fields.
 */
@Service
public class PullRequestService {

    private static final Logger log = LoggerFactory.getLogger(PullRequestService.class);

    private final PullRequestRepository prs;
    private final RepositoryRepository repositories;
    private final BranchRepository branches;
    private final PartnerRepository partners;
    private final StagingRepository stagings;
    private final SplitRepository splits;
    private final BatchService batchService;
    private final StagingService stagingService;
    private final CommitService commits;
    private final DerivedStateRecomputer recomputer;
    private final PullRequestMentions mentions;
    private final Outbox outbox;
    private final MergelineProperties props;

    public PullRequestService(
            PullRequestRepository prs,
            RepositoryRepository repositories,
            BranchRepository branches,
            PartnerRepository partners,
            StagingRepository stagings,
            SplitRepository splits,
            BatchService batchService,
            StagingService stagingService,
            CommitService commits,
            DerivedStateRecomputer recomputer,
            PullRequestMentions mentions,
            Outbox outbox,
            MergelineProperties props
    ) {
        this.prs = prs;
        this.repositories = repositories;
        this.branches = branches;
        this.partners = partners;
        this.stagings = stagings;
        this.splits = splits;
        this.batchService = batchService;
        this.stagingService = stagingService;
        this.commits = commits;
        this.recomputer = recomputer;
        this.mentions = mentions;
        this.outbox = outbox;
        this.props = props;
    }

    @Transactional
    public PullRequestEntity open(NewPullRequest req) {
        RepositoryEntity repo = repositories.findByName(req.repository())
                .orElseThrow(() -> new IllegalArgumentException("Repository not found: " + req.repository()));
        BranchEntity target = branches.findByName(req.target())
                .orElseThrow(() -> new IllegalArgumentException("Branch not found: " + req.target()));
        prs.findByRepositoryIdAndNumber(repo.getId(), req.number()).ifPresent(existing -> {
            throw new IllegalStateException(existing.displayName() + " is already tracked");
        });

        PartnerEntity author = partners.findByLogin(req.author())
                .orElseGet(() -> partners.save(new PartnerEntity(req.author())));

        PullRequestEntity pr = new PullRequestEntity(
                repo.getId(), repo.getName(), req.number(), target.getId(), repo.remapLabel(req.label()), req.head());
        pr.setAuthorId(author.getId());
        pr.setMessage(req.message());
        pr.setDraft(req.draft());
        pr.setSquash(req.commits() == 1);
        pr.setClosed(req.closed());
        if (!req.closed()) {
            pr.setBatchId(batchService.getOrCreate(target.getId(), pr.getLabel()).getId());
        }
        pr = prs.save(pr);

        validate(pr, commits.statusesOf(pr.getHead()));
        if (pr.getState() == PullRequestState.OPENED) {
            // still in the initial state, nothing was tagged yet
            outbox.changeTags(pr.getRepositoryId(), pr.getNumber(), List.of(), PullRequestTags.forState(pr.getState()));
        }

        if (!pr.getState().isTerminal()) {
            outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.PR_TRACKED, dashboardLink(pr));
        }
        log.info("Tracking {} ({} on {})", pr.displayName(), pr.getLabel(), target.getName());
        return pr;
    }

    /**
     * Copies the head's CI statuses onto the PR. A merged PR is frozen.
     */
    public void validate(PullRequestEntity pr, Map<String, CommitStatus> statuses) {
        if (pr.getState() == PullRequestState.MERGED) return;

        pr.setStatuses(statuses);
        recomputer.refresh(pr);

        if (pr.getStatus() != AggregateStatus.FAILURE) return;
        Map<String, CommitStatus> effective = recomputer.effectiveStatuses(pr);
        for (String ctx : recomputer.requiredFor(pr)) {
            CommitStatus st = effective.getOrDefault(ctx, CommitStatus.MISSING);
            if (st.state().isFailing()) notifyNewFailure(pr, ctx, st);
        }
    }

    /**
     * Re-validates every PR whose head is {@code sha}.
     */
    @Transactional
    public void validateHead(String sha) {
        Map<String, CommitStatus> statuses = commits.statusesOf(sha);
        for (PullRequestEntity pr : prs.findByHead(sha)) {
            validate(pr, statuses);
        }
    }

    @Transactional
    public PullRequestEntity updateHead(Long prId, String head, int commitCount) {
        PullRequestEntity pr = require(prId);
        if (Objects.equals(pr.getHead(), head)) return pr;

        unstage(pr, "updated by push");
        pr.setHead(head);
        pr.setReviewedById(null);
        pr.setError(false);
        pr.setSquash(commitCount == 1);
        validate(pr, commits.statusesOf(head));
        return pr;
    }

    @Transactional
    public PullRequestEntity retarget(Long prId, String branchName) {
        PullRequestEntity pr = require(prId);
        BranchEntity next = branches.findByName(branchName)
                .orElseThrow(() -> new IllegalArgumentException("Branch not found: " + branchName));
        if (Objects.equals(pr.getTargetId(), next.getId())) return pr;

        String previous = branches.findById(pr.getTargetId()).map(BranchEntity::displayName).orElse("?");
        unstage(pr, "target (base) branch was changed from '" + previous + "' to '" + next.displayName() + "'");
        moveBatch(pr, next.getId(), pr.getLabel());
        return pr;
    }

    @Transactional
    public PullRequestEntity relabel(Long prId, String label) {
        PullRequestEntity pr = require(prId);
        String remapped = repositories.findById(pr.getRepositoryId())
                .map(r -> r.remapLabel(label))
                .orElse(label);
        if (Objects.equals(pr.getLabel(), remapped)) return pr;

        unstage(pr, "label changed");
        moveBatch(pr, pr.getTargetId(), remapped);
        return pr;
    }

    @Transactional
    public PullRequestEntity setDraft(Long prId, boolean draft) {
        PullRequestEntity pr = require(prId);
        pr.setDraft(draft);
        recomputer.refresh(pr);
        return pr;
    }

    @Transactional
    public PullRequestEntity updateMessage(Long prId, String message) {
        PullRequestEntity pr = require(prId);
        MergeMethod method = pr.getMergeMethod();
        // rebase-ff keeps the PR's own commits, the message is never used
        if (method != null && method != MergeMethod.REBASE_FF && !Objects.equals(pr.getMessage(), message)) {
            unstage(pr, "merge message updated");
        }
        pr.setMessage(message);
        return pr;
    }

    /**
     * Closes the PR unless another transaction holds it, most likely to merge it.
     *
     * @return false if the PR was locked or already merged
     */
    @Transactional
    public boolean tryClosing(Long prId, String by) {
        Optional<PullRequestEntity> locked = prs.lockUnmergedSkipLocked(prId);
        if (locked.isEmpty()) return false;

        PullRequestEntity pr = locked.get();
        pr.setClosed(true);
        pr.setReviewedById(null);
        unstage(pr, "closed by " + by);

        Long previous = pr.getBatchId();
        pr.setBatchId(null);
        recomputer.refresh(pr);
        afterLeaving(previous);
        log.info("{} closed by {}", pr.displayName(), by);
        return true;
    }

    @Transactional
    public PullRequestEntity reopen(Long prId) {
        PullRequestEntity pr = require(prId);
        if (!pr.isClosed()) return pr;

        pr.setClosed(false);
        pr.setBatchId(batchService.getOrCreate(pr.getTargetId(), pr.getLabel()).getId());
        recomputer.refresh(pr);
        return pr;
    }

    /**
     * Pulls the PR's batch out of any split waiting to be staged and cancels
     * the active staging containing it.
     */
    public void unstage(PullRequestEntity pr, String reason) {
        Long batchId = pr.getBatchId();
        if (batchId == null) return;

        for (SplitEntity split : splits.findContainingBatch(batchId)) {
            split.removeBatch(batchId);
            if (split.isEmpty()) splits.delete(split);
        }
        for (StagingEntity staging : stagings.findActiveContainingBatch(batchId)) {
            stagingService.cancel(staging, pr.displayName() + " " + reason);
        }
    }

    public PullRequestEntity require(Long prId) {
        return prs.findById(prId)
                .orElseThrow(() -> new IllegalArgumentException("Pull request not found: " + prId));
    }

    private void moveBatch(PullRequestEntity pr, Long targetId, String label) {
        Long previous = pr.getBatchId();
        // detach first so the old batch does not match the new pair
        pr.setBatchId(null);
        pr.setTargetId(targetId);
        pr.setLabel(label);
        if (!pr.isClosed()) {
            pr.setBatchId(batchService.getOrCreate(targetId, label).getId());
        }
        recomputer.refresh(pr);
        afterLeaving(previous);
    }

    private void afterLeaving(Long batchId) {
        if (batchId == null) return;
        if (!batchService.deleteIfOrphaned(batchId)) {
            recomputer.refreshBatch(batchId);
        }
    }

    private void notifyNewFailure(PullRequestEntity pr, String ctx, CommitStatus st) {
        boolean known = pr.getPreviousFailures().values().stream().anyMatch(st::equivalentTo);
        if (known) return;

        pr.recordFailure(ctx, st);
        // only worth a ping once somebody approved the PR
        if (pr.getState() == PullRequestState.APPROVED) {
            outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.CI_FAILED_APPROVED, mentions.ping(pr), ctx);
        }
    }

    private String dashboardLink(PullRequestEntity pr) {
        return "[" + pr.displayName() + "](" + props.getDashboardUrl() + "/" + pr.getRepositoryName()
                + "/pull/" + pr.getNumber() + ")";
    }
}
