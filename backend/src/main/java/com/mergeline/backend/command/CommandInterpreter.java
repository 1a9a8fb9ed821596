package com.mergeline.backend.command;

import com.mergeline.backend.acl.AccessPolicy;
import com.mergeline.backend.acl.Acl;
import com.mergeline.backend.acl.PartnerEntity;
import com.mergeline.backend.acl.PartnerRepository;
import com.mergeline.backend.acl.Permission;
import com.mergeline.backend.batch.BatchEntity;
import com.mergeline.backend.batch.BatchRepository;
import com.mergeline.backend.commit.CiState;
import com.mergeline.backend.commit.CommitService;
import com.mergeline.backend.commit.CommitStatus;
import com.mergeline.backend.outbox.FeedbackTemplate;
import com.mergeline.backend.outbox.Outbox;
import com.mergeline.backend.pr.AggregateStatus;
import com.mergeline.backend.pr.DerivedStateRecomputer;
import com.mergeline.backend.pr.PullRequestEntity;
import com.mergeline.backend.pr.PullRequestRepository;
import com.mergeline.backend.pr.PullRequestService;
import com.mergeline.backend.pr.PullRequestState;
import com.mergeline.backend.registry.BranchEntity;
import com.mergeline.backend.registry.BranchRepository;
import com.mergeline.backend.staging.StagingRepository;
import com.mergeline.backend.staging.StagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/**
 * Applies the directives of one comment to a pull request.
 * <p>
 * A comment is all or nothing: if any directive is refused, everything the
 * others did is rolled back and a single message listing the refusals is
 * posted.
 */
@Service
public class CommandInterpreter {

    private static final Logger log = LoggerFactory.getLogger(CommandInterpreter.class);

    static final String NO_EMAIL = "I must know your email before you can review PRs. Please contact an administrator.";
    static final String ALREADY_REVIEWED = "this PR is already reviewed, reviewing it again is useless.";
    static final String IGNORED_FOOTER = "\n\nFor your own safety I've ignored everything in your comment.";

    private final PullRequestRepository prs;
    private final BatchRepository batches;
    private final BranchRepository branches;
    private final PartnerRepository partners;
    private final StagingRepository stagings;
    private final AccessPolicy policy;
    private final PullRequestService pullRequests;
    private final StagingService stagingService;
    private final CommitService commits;
    private final DerivedStateRecomputer recomputer;
    private final Outbox outbox;
    private final TransactionTemplate tx;

    public CommandInterpreter(
            PullRequestRepository prs,
            BatchRepository batches,
            BranchRepository branches,
            PartnerRepository partners,
            StagingRepository stagings,
            AccessPolicy policy,
            PullRequestService pullRequests,
            StagingService stagingService,
            CommitService commits,
            DerivedStateRecomputer recomputer,
            Outbox outbox,
            PlatformTransactionManager transactionManager
    ) {
        this.prs = prs;
        this.batches = batches;
        this.branches = branches;
        this.partners = partners;
        this.stagings = stagings;
        this.policy = policy;
        this.pullRequests = pullRequests;
        this.stagingService = stagingService;
        this.commits = commits;
        this.recomputer = recomputer;
        this.outbox = outbox;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    private record Outcome(CommandResult result, Long repositoryId, int number, String rejection) {}

    /**
     * @param login      login of the commenter, who may not be a known partner
     * @param commentUrl link to the comment, recorded on status overrides
     */
    public CommandResult apply(Long prId, List<Command> commands, String login, String commentUrl) {
        if (commands.isEmpty()) {
            log.info("found no commands in comment of {} on {}", login, prId);
            return CommandResult.OK;
        }

        Outcome outcome = tx.execute(status -> {
            Outcome o = interpret(prId, commands, login, commentUrl);
            if (o.result() == CommandResult.REJECTED) status.setRollbackOnly();
            return o;
        });

        // the rejection has to survive the rollback of everything else
        if (outcome.rejection() != null) {
            tx.executeWithoutResult(status -> outbox.comment(outcome.repositoryId(), outcome.number(), outcome.rejection()));
        }
        return outcome.result();
    }

    private Outcome interpret(Long prId, List<Command> commands, String login, String commentUrl) {
        PullRequestEntity pr = pullRequests.require(prId);
        PartnerEntity author = partners.findByLogin(login).orElse(null);
        String name = author == null ? "not in system" : author.getDisplayName();

        PullRequestEntity source = pr.getSourceId() == null ? null : prs.findById(pr.getSourceId()).orElse(null);
        Invocation inv = new Invocation(pr, author, login, commentUrl, policy.acl(author, pr), source, policy.acl(author, source));

        boolean overrider = commands.stream().anyMatch(c -> c instanceof Command.OverrideStatuses)
                && policy.hasAnyOverrideRight(author);
        if (!(inv.acl().isAuthor() || source != null || overrider)) {
            log.info("ignoring comment of {} ({}): no ACL to {}", login, name, pr.displayName());
            outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.ACCESS_DENIED, login, pr.displayName());
            return new Outcome(CommandResult.IGNORED, pr.getRepositoryId(), pr.getNumber(), null);
        }

        List<String> rejections = new ArrayList<>();
        for (Command command : commands) {
            String msg = dispatch(command, inv);
            if (msg != null) rejections.add(msg);
        }

        String cmdstr = commands.stream().map(Command::toString).collect(Collectors.joining(", "));
        if (rejections.isEmpty()) {
            inv.flush();
            log.info("{} ({}) applied {}", login, name, cmdstr);
            return new Outcome(CommandResult.APPLIED, pr.getRepositoryId(), pr.getNumber(), null);
        }

        String list = rejections.stream().map(r -> "\n- " + r).collect(Collectors.joining());
        log.info("{} ({}) tried to apply {}{}", login, name, cmdstr, list);
        String body = rejections.size() == 1 ? " " + rejections.get(0) : list;
        String footer = rejections.size() == commands.size() ? "" : IGNORED_FOOTER;
        return new Outcome(CommandResult.REJECTED, pr.getRepositoryId(), pr.getNumber(), "@" + login + body + footer);
    }

    /**
     * @return the reason the command was refused, null if it was applied
     */
    private String dispatch(Command command, Invocation inv) {
        PullRequestEntity pr = inv.pr();
        Acl acl = inv.acl();
        Acl sourceAcl = inv.sourceAcl();

        if (command instanceof Command.Approve approve) {
            if (pr.isDraft()) return "draft PRs can not be approved.";
            if (pr.getParentId() != null) return approveForwardPort(approve, inv);
            if (acl.isReviewer()) {
                if (approve.ids() != null && !approve.ids().equals(List.of(pr.getNumber()))) {
                    return "tried to approve PRs " + approve.ids() + " but the current PR is " + pr.getNumber();
                }
                return approveOne(pr, inv);
            }
        } else if (command instanceof Command.Reject && acl.isAuthor()) {
            return reject(inv);
        } else if (command instanceof Command.SetMergeMethod m && acl.isReviewer()) {
            pr.setMergeMethod(m.method());
            outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.MERGE_METHOD_SET, m.method().description());
            return null;
        } else if (command instanceof Command.Retry && (acl.isAuthor() || sourceAcl.isAuthor())) {
            if (!pr.isError()) return "retry makes no sense when the PR is not in error.";
            pr.setError(false);
            return null;
        } else if (command instanceof Command.Check && acl.isAuthor()) {
            outbox.fetch(pr.getRepositoryId(), pr.getNumber(), false);
            return null;
        } else if (command instanceof Command.Delegate d && acl.isReviewer()) {
            delegate(pr, d);
            return null;
        } else if (command instanceof Command.Priority p && acl.isAdmin()) {
            if (pr.getBatchId() == null) return command + " makes no sense on a closed PR.";
            batchOf(pr).setPriority(p.level());
            return null;
        } else if (command instanceof Command.SkipChecks && acl.isAdmin()) {
            if (pr.getBatchId() == null) return command + " makes no sense on a closed PR.";
            skipChecks(inv);
            return null;
        } else if (command instanceof Command.CancelStaging && acl.isAdmin()) {
            if (pr.getBatchId() == null) return command + " makes no sense on a closed PR.";
            cancelStaging(inv);
            return null;
        } else if (command instanceof Command.OverrideStatuses o) {
            return override(o, inv);
        } else if (command instanceof Command.Close && sourceAcl.isAuthor()) {
            outbox.close(pr.getRepositoryId(), pr.getNumber(), null);
            return null;
        } else if (command instanceof Command.Fw fw) {
            return forwardPortPolicy(fw, inv);
        } else if (command instanceof Command.Limit limit) {
            if (!acl.isAuthor()) return "you can't set a forward-port limit.";
            return limit(limit, inv);
        }
        return "you can't " + command + ".";
    }

    /**
     * Forward-port copies can be approved through their ancestors. A reviewer
     * of the source may approve the whole chain, anybody else the part after
     * the first ancestor they can review, and the source's author the part
     * after the first merged ancestor when that is longer.
     */
    private String approveForwardPort(Command.Approve approve, Invocation inv) {
        IntPredicate valid = approve.ids() == null ? n -> true : n -> approve.ids().contains(n);

        List<PullRequestEntity> ancestors = ancestors(inv.pr());
        List<PullRequestEntity> approvable;
        if (inv.sourceAcl().isReviewer()) {
            approvable = ancestors;
        } else {
            List<PullRequestEntity> fromRoot = new ArrayList<>(ancestors);
            Collections.reverse(fromRoot);
            List<PullRequestEntity> mergeors = fromRoot.stream()
                    .dropWhile(p -> p.getState() != PullRequestState.MERGED)
                    .toList();
            List<PullRequestEntity> reviewors = fromRoot.stream()
                    .dropWhile(p -> !policy.can(inv.author(), Permission.REVIEW, p))
                    .toList();
            approvable = inv.sourceAcl().isAuthor() && mergeors.size() > reviewors.size() ? mergeors : reviewors;
        }

        if (approvable.isEmpty()) return "you can't " + approve + ".";
        for (PullRequestEntity p : approvable) {
            if (p.getState().afterApproval() == null || !valid.test(p.getNumber())) continue;
            String msg = approveOne(p, inv);
            if (msg != null) return msg;
        }
        return null;
    }

    private String approveOne(PullRequestEntity pr, Invocation inv) {
        PullRequestState before = pr.getState();
        PullRequestState after = before.afterApproval();
        String msg = null;
        if (inv.author() == null || !inv.author().hasEmail()) {
            msg = NO_EMAIL;
        } else if (after == null) {
            msg = ALREADY_REVIEWED;
        } else {
            pr.setReviewedById(inv.author().getId());
            inv.touched().add(pr.getId());
        }
        log.debug("r+ on {} by {} ({}->{}) status={}", pr.displayName(), inv.login(), before,
                after == null ? before : after, pr.getStatus());
        if (pr.getStatus() == AggregateStatus.FAILURE) {
            outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.APPROVE_FAILED_CI, inv.login());
        }
        return msg;
    }

    private String reject(Invocation inv) {
        PullRequestEntity pr = inv.pr();
        BatchEntity batch = pr.getBatchId() == null ? null : batchOf(pr);
        boolean skipchecks = batch != null && batch.isSkipchecks();
        if (!skipchecks && !pr.isReviewed()) return "r- makes no sense in the current PR state.";

        pr.setError(false);
        pr.setReviewedById(null);
        if (skipchecks) {
            batch.setSkipchecks(false);
            inv.touchedBatches().add(batch.getId());
            outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.UNAPPROVE_SKIPCHECKS, inv.login());
        }
        pullRequests.unstage(pr, "unreviewed (r-) by " + inv.login());
        return null;
    }

    private void delegate(PullRequestEntity pr, Command.Delegate d) {
        if (d.users().isEmpty()) {
            if (pr.getAuthorId() != null) pr.addDelegate(pr.getAuthorId());
            return;
        }
        for (String login : d.users()) {
            PartnerEntity delegate = partners.findByLogin(login)
                    .orElseGet(() -> partners.save(new PartnerEntity(login)));
            pr.addDelegate(delegate.getId());
        }
    }

    private void skipChecks(Invocation inv) {
        PullRequestEntity pr = inv.pr();
        BatchEntity batch = batchOf(pr);
        batch.setSkipchecks(true);
        inv.touchedBatches().add(batch.getId());

        Long reviewer = inv.author().getId();
        pr.setReviewedById(reviewer);
        for (PullRequestEntity mate : prs.findByBatchIdOrderById(batch.getId())) {
            if (!mate.isReviewed()) mate.setReviewedById(reviewer);
        }
    }

    private void cancelStaging(Invocation inv) {
        PullRequestEntity pr = inv.pr();
        BatchEntity batch = batchOf(pr);
        batch.setCancelStaging(true);

        boolean blocked = prs.findByBatchIdOrderById(batch.getId()).stream().anyMatch(m -> m.getBlocked() != null);
        if (blocked) return;
        stagings.findFirstByTargetIdAndActiveTrue(pr.getTargetId()).ifPresent(s ->
                stagingService.cancel(s, "Unstaged by " + inv.login() + " on " + pr.displayName()));
    }

    private String override(Command.OverrideStatuses o, Invocation inv) {
        PullRequestEntity pr = inv.pr();
        String msg = null;
        for (String ctx : o.contexts()) {
            if (!policy.canOverride(inv.author(), ctx, pr.getRepositoryId())) {
                msg = "you are not allowed to override '" + ctx + "'.";
                continue;
            }
            pr.putOverride(ctx, new CommitStatus(CiState.SUCCESS, inv.commentUrl(), "Overridden by @" + inv.author().getLogin()));
            commits.markToCheck(pr.getHead());
            inv.overridden().add(pr.getId());
        }
        return msg;
    }

    private String forwardPortPolicy(Command.Fw fw, Invocation inv) {
        if (!(inv.sourceAcl().isReviewer() || inv.acl().isReviewer())) {
            return "you can't configure forward-port CI.";
        }
        PullRequestEntity owner = inv.source() != null ? inv.source() : inv.pr();
        if (owner.getBatchId() != null) batchOf(owner).setFwPolicy(fw.policy());

        FeedbackTemplate template = switch (fw.policy()) {
            case DEFAULT -> FeedbackTemplate.FW_DEFAULT;
            case SKIPCI -> FeedbackTemplate.FW_SKIPCI;
            case SKIPMERGE -> FeedbackTemplate.FW_SKIPMERGE;
        };
        outbox.comment(inv.pr().getRepositoryId(), inv.pr().getNumber(), template);
        return null;
    }

    private String limit(Command.Limit limit, Invocation inv) {
        PullRequestEntity pr = inv.pr();
        String name = limit.branch();
        if (name == null) {
            name = branches.findById(pr.getTargetId()).map(BranchEntity::getName).orElse(null);
        }
        BranchEntity branch = name == null ? null : branches.findByName(name).orElse(null);
        if (branch == null) return "there is no branch '" + name + "', it can't be used as a forward port target.";
        if (!branch.isActive()) return "branch '" + name + "' is disabled, it can't be used as a forward port target.";

        pr.setLimitBranchId(branch.getId());
        outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.FW_LIMIT_SET, branch.getName());
        return null;
    }

    private BatchEntity batchOf(PullRequestEntity pr) {
        if (pr.getBatchId() == null) {
            throw new IllegalStateException(pr.displayName() + " is not in a batch");
        }
        return batches.findById(pr.getBatchId())
                .orElseThrow(() -> new IllegalArgumentException("Batch not found: " + pr.getBatchId()));
    }

    /**
     * The PR itself first, then its parent, up to the root of the chain.
     */
    private List<PullRequestEntity> ancestors(PullRequestEntity pr) {
        List<PullRequestEntity> out = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        PullRequestEntity current = pr;
        while (current != null && seen.add(current.getId())) {
            out.add(current);
            current = current.getParentId() == null ? null : prs.findById(current.getParentId()).orElse(null);
        }
        return out;
    }

    private final class Invocation {
        private final PullRequestEntity pr;
        private final PartnerEntity author;
        private final String login;
        private final String commentUrl;
        private final Acl acl;
        private final PullRequestEntity source;
        private final Acl sourceAcl;

        private final Set<Long> touched = new LinkedHashSet<>();
        private final Set<Long> touchedBatches = new LinkedHashSet<>();
        private final Set<Long> overridden = new LinkedHashSet<>();

        Invocation(PullRequestEntity pr, PartnerEntity author, String login, String commentUrl,
                   Acl acl, PullRequestEntity source, Acl sourceAcl) {
            this.pr = pr;
            this.author = author;
            this.login = login;
            this.commentUrl = commentUrl;
            this.acl = acl;
            this.source = source;
            this.sourceAcl = sourceAcl;
            this.touched.add(pr.getId());
        }

        PullRequestEntity pr() { return pr; }
        PartnerEntity author() { return author; }
        String login() { return login; }
        String commentUrl() { return commentUrl; }
        Acl acl() { return acl; }
        PullRequestEntity source() { return source; }
        Acl sourceAcl() { return sourceAcl; }
        Set<Long> touched() { return touched; }
        Set<Long> touchedBatches() { return touchedBatches; }
        Set<Long> overridden() { return overridden; }

        /**
         * Brings the derived fields of everything the comment touched up to date.
         */
        void flush() {
            for (Long id : overridden) {
                prs.findById(id).ifPresent(recomputer::refreshWithDescendants);
            }
            for (Long batchId : touchedBatches) {
                recomputer.refreshBatch(batchId);
            }
            recomputer.refresh(touched);
            if (pr.getBatchId() != null) recomputer.refreshBatch(pr.getBatchId());
        }
    }
}
