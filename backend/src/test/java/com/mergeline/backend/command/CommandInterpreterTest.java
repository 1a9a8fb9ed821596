package com.mergeline.backend.command;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import com.mergeline.backend.acl.PartnerEntity;
import com.mergeline.backend.acl.ReviewRightEntity;
import com.mergeline.backend.batch.BatchEntity;
import com.mergeline.backend.batch.BatchPriority;
import com.mergeline.backend.batch.ForwardPortPolicy;
import com.mergeline.backend.commit.CiState;
import com.mergeline.backend.commit.CommitStatus;
import com.mergeline.backend.outbox.FeedbackEntity;
import com.mergeline.backend.pr.AggregateStatus;
import com.mergeline.backend.pr.MergeMethod;
import com.mergeline.backend.pr.NewPullRequest;
import com.mergeline.backend.pr.PullRequestEntity;
import com.mergeline.backend.pr.PullRequestState;
import com.mergeline.backend.registry.BranchEntity;
import com.mergeline.backend.registry.RepositoryEntity;
import com.mergeline.backend.staging.StagedCommit;
import com.mergeline.backend.staging.StagingEntity;
import com.mergeline.backend.staging.StagingService;
import com.mergeline.backend.staging.StagingState;
import com.mergeline.backend.support.MergeQueueTestSupport;

public class CommandInterpreterTest extends MergeQueueTestSupport {

    private static final String COMMENT_URL = "http://remote.test/odoo/pull/1#comment-1";

    @Autowired
    private CommandInterpreter interpreter;

    @Autowired
    private StagingService stagingService;

    private RepositoryEntity odoo;
    private BranchEntity master;
    private PartnerEntity rev;

    @BeforeEach
    void setUp() {
        odoo = repository("odoo", "ci");
        master = branch("master");
        rev = reviewer("rev", odoo);
    }

    private CommandResult comment(PullRequestEntity pr, String login, Command... commands) {
        return interpreter.apply(pr.getId(), List.of(commands), login, COMMENT_URL);
    }

    private String lastMessage(PullRequestEntity pr) {
        List<String> all = messages(pr);
        return all.get(all.size() - 1);
    }

    private BatchEntity batchOf(PullRequestEntity pr) {
        return batches.findById(reload(pr).getBatchId()).orElseThrow();
    }

    /**
     * Opens a forward-port of {@code parent} made by the bot on {@code target}.
     */
    private PullRequestEntity forwardPort(PullRequestEntity parent, int number, BranchEntity target) {
        PullRequestEntity fp = open(odoo, number, target, "dev:feature-fw" + number, "fw-bot");
        Long sourceId = parent.getSourceId() != null ? parent.getSourceId() : parent.getId();
        inTransaction(() -> {
            PullRequestEntity managed = prs.findById(fp.getId()).orElseThrow();
            managed.setParentId(parent.getId());
            managed.setSourceId(sourceId);
        });
        return reload(fp);
    }

    private void giveEmail(String login) {
        inTransaction(() -> partners.findByLogin(login).orElseThrow().setEmail(login + "@example.com"));
    }

    @Test
    void approveByReviewer_movesPrToApproved() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.APPLIED, comment(pr, "rev", new Command.Approve()));

        PullRequestEntity after = reload(pr);
        assertEquals(rev.getId(), after.getReviewedById());
        assertEquals(PullRequestState.APPROVED, after.getState());
    }

    @Test
    void approveOfValidatedPr_makesItReady() {
        status(headOf(odoo, 1), "ci", CiState.SUCCESS);
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");
        assertEquals(PullRequestState.VALIDATED, pr.getState());

        comment(pr, "rev", new Command.Approve());

        assertEquals(PullRequestState.READY, reload(pr).getState());
    }

    @Test
    void approveOfFailingPr_warnsButApproves() {
        status(headOf(odoo, 1), "ci", CiState.FAILURE);
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.APPLIED, comment(pr, "rev", new Command.Approve()));

        assertEquals(rev.getId(), reload(pr).getReviewedById());
        assertEquals("@rev you may want to rebuild or fix this PR as it has failed CI.", lastMessage(pr));
    }

    @Test
    void approveOfAnotherNumber_isRejected() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.REJECTED, comment(pr, "rev", new Command.Approve(List.of(2))));

        assertNull(reload(pr).getReviewedById());
        assertEquals("@rev tried to approve PRs [2] but the current PR is 1", lastMessage(pr));
    }

    @Test
    void oneRefusedDirective_rollsBackTheOthers_andPostsOneMessage() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");
        PartnerEntity helper = partner("helper", "helper@example.com");
        inTransaction(() -> prs.findById(pr.getId()).orElseThrow().addDelegate(helper.getId()));
        int before = messages(pr).size();

        CommandResult result = comment(pr, "helper", new Command.Approve(), new Command.Priority(BatchPriority.ALONE));

        assertEquals(CommandResult.REJECTED, result);
        PullRequestEntity after = reload(pr);
        assertNull(after.getReviewedById());
        assertEquals(PullRequestState.OPENED, after.getState());
        assertEquals(BatchPriority.DEFAULT, batchOf(pr).getPriority());

        List<String> all = messages(pr);
        assertEquals(before + 1, all.size());
        assertEquals("@helper you can't alone." + CommandInterpreter.IGNORED_FOOTER, all.get(all.size() - 1));
    }

    @Test
    void everyDirectiveRefused_listsThemWithoutFooter() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.REJECTED, comment(pr, "author", new Command.Approve(), new Command.SkipChecks()));

        assertEquals("@author\n- you can't r+.\n- you can't skipchecks.", lastMessage(pr));
        assertFalse(batchOf(pr).isSkipchecks());
    }

    @Test
    void unknownUser_isIgnoredWithAccessDenied() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.IGNORED, comment(pr, "stranger", new Command.Approve()));

        assertNull(reload(pr).getReviewedById());
        assertEquals("@stranger you are not allowed to issue commands on odoo#1.", lastMessage(pr));
    }

    @Test
    void reviewerWithoutEmail_cannotApprove() {
        PartnerEntity anonymous = partner("anonymous", null);
        reviewRights.save(new ReviewRightEntity(anonymous.getId(), odoo.getId(), true, false));
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.REJECTED, comment(pr, "anonymous", new Command.Approve()));

        assertNull(reload(pr).getReviewedById());
        assertEquals("@anonymous " + CommandInterpreter.NO_EMAIL, lastMessage(pr));
    }

    @Test
    void approvingTwice_isRefused() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");
        comment(pr, "rev", new Command.Approve());

        assertEquals(CommandResult.REJECTED, comment(pr, "rev", new Command.Approve()));
        assertEquals("@rev " + CommandInterpreter.ALREADY_REVIEWED, lastMessage(pr));
    }

    @Test
    void authorCanUnreview() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");
        comment(pr, "rev", new Command.Approve());

        assertEquals(CommandResult.APPLIED, comment(pr, "author", new Command.Reject()));

        PullRequestEntity after = reload(pr);
        assertNull(after.getReviewedById());
        assertEquals(PullRequestState.OPENED, after.getState());
    }

    @Test
    void unreviewingUnreviewedPr_makesNoSense() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.REJECTED, comment(pr, "author", new Command.Reject()));
        assertEquals("@author r- makes no sense in the current PR state.", lastMessage(pr));
    }

    @Test
    void skipchecks_approvesTheBatch_andUnreviewClearsIt() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.APPLIED, comment(pr, "rev", new Command.SkipChecks()));
        assertTrue(batchOf(pr).isSkipchecks());
        assertEquals(rev.getId(), reload(pr).getReviewedById());
        assertNull(reload(pr).getBlocked());

        assertEquals(CommandResult.APPLIED, comment(pr, "rev", new Command.Reject()));
        assertFalse(batchOf(pr).isSkipchecks());
        assertEquals("@rev skipchecks removed due to r-.", lastMessage(pr));
    }

    @Test
    void mergeMethod_isSetAndAnnounced() {
        PullRequestEntity pr = pullRequests.open(new NewPullRequest(
                "odoo", 1, "master", "dev:feature", "odoo-1", "author", 3, "three commits", false, false));

        assertEquals(CommandResult.APPLIED, comment(pr, "rev", new Command.SetMergeMethod(MergeMethod.REBASE_MERGE)));

        assertEquals(MergeMethod.REBASE_MERGE, reload(pr).getMergeMethod());
        assertEquals("Merge method set to rebase and merge, using the PR as merge commit message.", lastMessage(pr));
    }

    @Test
    void check_queuesAFetch() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.APPLIED, comment(pr, "author", new Command.Check()));
        assertTrue(fetchJobs.existsByRepositoryIdAndPullRequestAndActiveTrue(odoo.getId(), 1));
    }

    @Test
    void retry_needsAnErroredPr() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.REJECTED, comment(pr, "author", new Command.Retry()));
        assertEquals("@author retry makes no sense when the PR is not in error.", lastMessage(pr));

        inTransaction(() -> prs.findById(pr.getId()).orElseThrow().setError(true));
        assertEquals(CommandResult.APPLIED, comment(pr, "author", new Command.Retry()));
        assertFalse(reload(pr).isError());
    }

    @Test
    void override_forcesContextToSuccess() {
        status(headOf(odoo, 1), "ci", CiState.FAILURE);
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");
        PartnerEntity ops = partner("ops", "ops@example.com");
        canOverride(ops, odoo, "ci");
        assertEquals(AggregateStatus.FAILURE, pr.getStatus());

        assertEquals(CommandResult.APPLIED, comment(pr, "ops", new Command.OverrideStatuses(List.of("ci"))));

        PullRequestEntity after = reload(pr);
        CommitStatus forced = after.getOverrides().get("ci");
        assertEquals(CiState.SUCCESS, forced.state());
        assertEquals(COMMENT_URL, forced.targetUrl());
        assertEquals("Overridden by @ops", forced.description());
        assertEquals(AggregateStatus.SUCCESS, after.getStatus());
        assertTrue(commitRepository.findBySha(headOf(odoo, 1)).orElseThrow().isToCheck());
    }

    @Test
    void override_ofUngrantedContext_isRefused() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");
        PartnerEntity ops = partner("ops", "ops@example.com");
        canOverride(ops, odoo, "ci");

        assertEquals(CommandResult.REJECTED, comment(pr, "ops", new Command.OverrideStatuses(List.of("lint"))));

        assertTrue(reload(pr).getOverrides().isEmpty());
        assertEquals("@ops you are not allowed to override 'lint'.", lastMessage(pr));
    }

    @Test
    void override_appliesToDescendantsButNotAncestors() {
        status(headOf(odoo, 1), "ci", CiState.FAILURE);
        status(headOf(odoo, 2), "ci", CiState.FAILURE);
        status(headOf(odoo, 3), "ci", CiState.FAILURE);
        PullRequestEntity root = open(odoo, 1, master, "dev:feature", "author");
        PullRequestEntity middle = open(odoo, 2, master, "dev:feature-fw", "author");
        PullRequestEntity leaf = open(odoo, 3, master, "dev:feature-fw2", "author");
        inTransaction(() -> {
            PullRequestEntity m = prs.findById(middle.getId()).orElseThrow();
            m.setParentId(root.getId());
            m.setSourceId(root.getId());
            PullRequestEntity l = prs.findById(leaf.getId()).orElseThrow();
            l.setParentId(middle.getId());
            l.setSourceId(root.getId());
        });
        PartnerEntity ops = partner("ops", "ops@example.com");
        canOverride(ops, odoo, "ci");

        assertEquals(CommandResult.APPLIED, comment(middle, "ops", new Command.OverrideStatuses(List.of("ci"))));

        assertEquals(AggregateStatus.FAILURE, reload(root).getStatus());
        assertEquals(AggregateStatus.SUCCESS, reload(middle).getStatus());
        assertEquals(AggregateStatus.SUCCESS, reload(leaf).getStatus());
        assertTrue(reload(leaf).getOverrides().isEmpty());
    }

    @Test
    void limit_toUnknownBranch_isRefused() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.REJECTED, comment(pr, "author", new Command.Limit("saas-99")));
        assertEquals("@author there is no branch 'saas-99', it can't be used as a forward port target.", lastMessage(pr));
    }

    @Test
    void limit_toActiveBranch_isRecorded() {
        BranchEntity stable = branch("17.0");
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.APPLIED, comment(pr, "author", new Command.Limit("17.0")));
        assertEquals(stable.getId(), reload(pr).getLimitBranchId());
        assertEquals("Forward-porting to 17.0.", lastMessage(pr));
    }

    @Test
    void adminDirectivesOnClosedPr_areRefused() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");
        assertTrue(pullRequests.tryClosing(pr.getId(), "author"));
        assertNull(reload(pr).getBatchId());

        assertEquals(CommandResult.REJECTED, comment(pr, "rev", new Command.Priority(BatchPriority.ALONE)));
        assertEquals("@rev alone makes no sense on a closed PR.", lastMessage(pr));

        assertEquals(CommandResult.REJECTED,
                comment(pr, "rev", new Command.SkipChecks(), new Command.CancelStaging()));
        assertEquals("@rev\n- skipchecks makes no sense on a closed PR.\n- cancel=staging makes no sense on a closed PR.",
                lastMessage(pr));
        assertNull(reload(pr).getReviewedById());
    }

    @Test
    void cancelStaging_unstagesTheBatch() {
        status(headOf(odoo, 1), "ci", CiState.SUCCESS);
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");
        comment(pr, "rev", new Command.Approve());
        StagingEntity staging = stagingService.stage(master.getId(), List.of(pr.getBatchId()),
                List.of(new StagedCommit(odoo.getId(), "stg-odoo")), List.of(), Map.of());

        assertEquals(CommandResult.APPLIED, comment(pr, "rev", new Command.CancelStaging()));

        StagingEntity cancelled = stagings.findById(staging.getId()).orElseThrow();
        assertFalse(cancelled.isActive());
        assertEquals(StagingState.CANCELLED, cancelled.getState());
        assertEquals("Unstaged by rev on odoo#1", cancelled.getReason());
        assertTrue(batchOf(pr).isCancelStaging());
    }

    @Test
    void cancelStaging_needsAnAdmin() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.REJECTED, comment(pr, "author", new Command.CancelStaging()));
        assertEquals("@author you can't cancel=staging.", lastMessage(pr));
        assertFalse(batchOf(pr).isCancelStaging());
    }

    @Test
    void delegateToLogins_letsThemReview() {
        partner("helper", "helper@example.com");
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.APPLIED,
                comment(pr, "rev", new Command.Delegate(List.of("helper", "newcomer"))));

        PartnerEntity helper = partners.findByLogin("helper").orElseThrow();
        PartnerEntity newcomer = partners.findByLogin("newcomer").orElseThrow();
        assertTrue(reload(pr).getDelegateIds().containsAll(List.of(helper.getId(), newcomer.getId())));

        assertEquals(CommandResult.APPLIED, comment(pr, "helper", new Command.Approve()));
        assertEquals(helper.getId(), reload(pr).getReviewedById());
    }

    @Test
    void sourceReviewer_approvesTheWholeChain() {
        PullRequestEntity root = open(odoo, 1, branch("16.0"), "dev:feature", "author");
        PullRequestEntity fp1 = forwardPort(root, 2, branch("17.0"));
        PullRequestEntity fp2 = forwardPort(fp1, 3, master);

        assertEquals(CommandResult.APPLIED, comment(fp2, "rev", new Command.Approve()));

        for (PullRequestEntity pr : List.of(root, fp1, fp2)) {
            assertEquals(rev.getId(), reload(pr).getReviewedById());
            assertEquals(PullRequestState.APPROVED, reload(pr).getState());
        }
    }

    @Test
    void forwardPortApproval_startsAtTheFirstAncestorTheUserCanReview() {
        PartnerEntity helper = partner("helper", "helper@example.com");
        PullRequestEntity root = open(odoo, 1, branch("16.0"), "dev:feature", "author");
        PullRequestEntity fp1 = forwardPort(root, 2, branch("17.0"));
        PullRequestEntity fp2 = forwardPort(fp1, 3, master);
        inTransaction(() -> prs.findById(fp1.getId()).orElseThrow().addDelegate(helper.getId()));

        assertEquals(CommandResult.APPLIED, comment(fp2, "helper", new Command.Approve()));

        assertNull(reload(root).getReviewedById());
        assertEquals(helper.getId(), reload(fp1).getReviewedById());
        assertEquals(helper.getId(), reload(fp2).getReviewedById());
    }

    @Test
    void forwardPortApproval_withoutAnyReviewableAncestor_isRefused() {
        partner("helper", "helper@example.com");
        PullRequestEntity root = open(odoo, 1, branch("16.0"), "dev:feature", "author");
        PullRequestEntity fp1 = forwardPort(root, 2, master);

        assertEquals(CommandResult.REJECTED, comment(fp1, "helper", new Command.Approve()));

        assertEquals("@helper you can't r+.", lastMessage(fp1));
        assertNull(reload(fp1).getReviewedById());
    }

    @Test
    void sourceAuthor_approvesEverythingAfterTheMergedAncestor() {
        PullRequestEntity root = open(odoo, 1, branch("16.0"), "dev:feature", "author");
        PullRequestEntity fp1 = forwardPort(root, 2, branch("17.0"));
        PullRequestEntity fp2 = forwardPort(fp1, 3, branch("saas-17.1"));
        PullRequestEntity fp3 = forwardPort(fp2, 4, master);
        giveEmail("author");
        PartnerEntity author = partners.findByLogin("author").orElseThrow();
        inTransaction(() -> batches.findById(root.getBatchId()).orElseThrow().markMerged(Instant.now()));
        recomputer.refreshBatch(root.getBatchId());
        // a delegation further down the chain is the shorter segment
        inTransaction(() -> prs.findById(fp2.getId()).orElseThrow().addDelegate(author.getId()));

        assertEquals(CommandResult.APPLIED, comment(fp3, "author", new Command.Approve()));

        assertEquals(PullRequestState.MERGED, reload(root).getState());
        assertNull(reload(root).getReviewedById());
        for (PullRequestEntity pr : List.of(fp1, fp2, fp3)) {
            assertEquals(author.getId(), reload(pr).getReviewedById());
        }
    }

    @Test
    void approveWithIds_onlyApprovesTheListedAncestors() {
        PullRequestEntity root = open(odoo, 1, branch("16.0"), "dev:feature", "author");
        PullRequestEntity fp1 = forwardPort(root, 2, branch("17.0"));
        PullRequestEntity fp2 = forwardPort(fp1, 3, master);

        assertEquals(CommandResult.APPLIED, comment(fp2, "rev", new Command.Approve(List.of(1, 3))));

        assertEquals(rev.getId(), reload(root).getReviewedById());
        assertNull(reload(fp1).getReviewedById());
        assertEquals(rev.getId(), reload(fp2).getReviewedById());
    }

    @Test
    void retry_onForwardPort_isAllowedToTheSourceAuthor() {
        PullRequestEntity root = open(odoo, 1, branch("16.0"), "dev:feature", "author");
        PullRequestEntity fp = forwardPort(root, 2, master);
        inTransaction(() -> prs.findById(fp.getId()).orElseThrow().setError(true));

        assertEquals(CommandResult.APPLIED, comment(fp, "author", new Command.Retry()));

        assertFalse(reload(fp).isError());
    }

    @Test
    void close_onForwardPort_isQueuedForTheSourceAuthor() {
        PullRequestEntity root = open(odoo, 1, branch("16.0"), "dev:feature", "author");
        PullRequestEntity fp = forwardPort(root, 2, master);

        assertEquals(CommandResult.APPLIED, comment(fp, "author", new Command.Close()));

        List<FeedbackEntity> closing = feedbackOf(fp).stream().filter(FeedbackEntity::isClose).toList();
        assertEquals(1, closing.size());
        assertNull(closing.get(0).getMessage());
    }

    @Test
    void close_onRegularPr_isRefused() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.REJECTED, comment(pr, "author", new Command.Close()));

        assertEquals("@author you can't close.", lastMessage(pr));
        assertTrue(feedbackOf(pr).stream().noneMatch(FeedbackEntity::isClose));
    }

    @Test
    void fw_setsThePolicyOnTheSourceBatch() {
        PullRequestEntity root = open(odoo, 1, branch("16.0"), "dev:feature", "author");
        PullRequestEntity fp = forwardPort(root, 2, master);

        assertEquals(CommandResult.APPLIED, comment(fp, "rev", new Command.Fw(ForwardPortPolicy.SKIPCI)));

        assertEquals(ForwardPortPolicy.SKIPCI, batchOf(root).getFwPolicy());
        assertEquals("Not waiting for CI to create followup forward-ports.", lastMessage(fp));
    }

    @Test
    void fw_needsAReviewer() {
        PullRequestEntity pr = open(odoo, 1, master, "dev:feature", "author");

        assertEquals(CommandResult.REJECTED, comment(pr, "author", new Command.Fw(ForwardPortPolicy.SKIPMERGE)));

        assertEquals("@author you can't configure forward-port CI.", lastMessage(pr));
        assertEquals(ForwardPortPolicy.DEFAULT, batchOf(pr).getFwPolicy());
    }
}
