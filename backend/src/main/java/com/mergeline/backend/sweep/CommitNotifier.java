package com.mergeline.backend.sweep;

import com.mergeline.backend.commit.CommitEntity;
import com.mergeline.backend.commit.CommitRepository;
import com.mergeline.backend.pr.PullRequestService;
import com.mergeline.backend.staging.StagingEntity;
import com.mergeline.backend.staging.StagingRepository;
import com.mergeline.backend.staging.StagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Propagates new commit statuses to the PRs and pending stagings using them.
 * Each commit is handled in its own transaction: one failing does not hold
 * back the others.
 */
@Component
public class CommitNotifier {

    private static final Logger log = LoggerFactory.getLogger(CommitNotifier.class);

    private final CommitRepository commits;
    private final StagingRepository stagings;
    private final PullRequestService pullRequests;
    private final StagingService stagingService;
    private final TransactionTemplate tx;

    public CommitNotifier(
            CommitRepository commits,
            StagingRepository stagings,
            PullRequestService pullRequests,
            StagingService stagingService,
            PlatformTransactionManager transactionManager
    ) {
        this.commits = commits;
        this.stagings = stagings;
        this.pullRequests = pullRequests;
        this.stagingService = stagingService;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * @return number of commits processed successfully
     */
    public int sweep() {
        int done = 0;
        for (Long id : commits.findIdsToCheck()) {
            try {
                tx.executeWithoutResult(status -> notifyOne(id));
                done++;
            } catch (RuntimeException e) {
                log.error("Failed to process statuses of commit {}", id, e);
            }
        }
        return done;
    }

    private void notifyOne(Long id) {
        CommitEntity commit = commits.findById(id).orElse(null);
        if (commit == null || !commit.isToCheck()) return;

        pullRequests.validateHead(commit.getSha());
        for (StagingEntity staging : stagings.findPendingByHead(commit.getSha())) {
            stagingService.validate(staging.getId());
        }
        commit.setToCheck(false);
    }
}
