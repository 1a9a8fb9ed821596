package com.mergeline.backend.registry;

import com.mergeline.backend.outbox.FeedbackTemplate;
import com.mergeline.backend.outbox.Outbox;
import com.mergeline.backend.pr.PullRequestEntity;
import com.mergeline.backend.pr.PullRequestMentions;
import com.mergeline.backend.pr.PullRequestRepository;
import com.mergeline.backend.pr.PullRequestState;
import com.mergeline.backend.staging.StagingRepository;
import com.mergeline.backend.staging.StagingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class BranchService {

    private static final Logger log = LoggerFactory.getLogger(BranchService.class);

    private final BranchRepository branches;
    private final StagingRepository stagings;
    private final StagingService stagingService;
    private final PullRequestRepository prs;
    private final PullRequestMentions mentions;
    private final Outbox outbox;

    public BranchService(
            BranchRepository branches,
            StagingRepository stagings,
            StagingService stagingService,
            PullRequestRepository prs,
            PullRequestMentions mentions,
            Outbox outbox
    ) {
        this.branches = branches;
        this.stagings = stagings;
        this.stagingService = stagingService;
        this.prs = prs;
        this.mentions = mentions;
        this.outbox = outbox;
    }

    /**
     * Stops merging into the branch: its active staging is cancelled and
     * every open PR targeting it is told so.
     */
    @Transactional
    public BranchEntity deactivate(Long branchId, String by) {
        BranchEntity branch = branches.findById(branchId)
                .orElseThrow(() -> new IllegalArgumentException("Branch not found: " + branchId));
        if (!branch.isActive()) return branch;

        branch.setActive(false);
        stagings.findFirstByTargetIdAndActiveTrue(branchId).ifPresent(s ->
                stagingService.cancel(s, "Target branch deactivated by '" + by + "'."));

        List<PullRequestEntity> open = prs.findByTargetIdAndStateNotIn(
                branchId, List.of(PullRequestState.MERGED, PullRequestState.CLOSED));
        for (PullRequestEntity pr : open) {
            outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.BRANCH_DISABLED,
                    mentions.ping(pr), branch.getName());
        }
        log.info("Branch {} deactivated by {}, {} open PR(s) notified", branch.getName(), by, open.size());
        return branch;
    }
}
