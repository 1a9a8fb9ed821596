package com.mergeline.backend.sweep;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@EnableScheduling
@ConditionalOnProperty(name = "mergeline.scheduler.enabled", havingValue = "true")
public class MergeQueueJob {

    private static final Logger log = LoggerFactory.getLogger(MergeQueueJob.class);

    private final CommitNotifier commitNotifier;
    private final StagingChecker stagingChecker;
    private final LinkedPullRequestNotifier linkedNotifier;

    public MergeQueueJob(CommitNotifier commitNotifier, StagingChecker stagingChecker,
                         LinkedPullRequestNotifier linkedNotifier) {
        this.commitNotifier = commitNotifier;
        this.stagingChecker = stagingChecker;
        this.linkedNotifier = linkedNotifier;
    }

    @Scheduled(fixedDelayString = "${mergeline.scheduler.interval:PT30S}")
    public void run() {
        int commits = commitNotifier.sweep();
        int stagings = stagingChecker.sweep();
        try {
            linkedNotifier.sweep();
        } catch (RuntimeException e) {
            log.error("Linked PR warnings failed", e);
        }
        log.debug("Sweep done: {} commit(s), {} staging(s)", commits, stagings);
    }
}
