package com.mergeline.backend.commit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

@Service
public class CommitService {

    private static final Logger log = LoggerFactory.getLogger(CommitService.class);

    private final CommitRepository commits;

    public CommitService(CommitRepository commits) {
        this.commits = commits;
    }

    @Transactional
    public CommitEntity recordStatus(StatusUpdate update) {
        if (update.sha() == null || update.sha().isBlank()) throw new IllegalArgumentException("sha is required");
        if (update.context() == null || update.context().isBlank()) throw new IllegalArgumentException("context is required");

        CommitEntity c = findOrCreate(update.sha());
        c.putStatus(update.context(), new CommitStatus(update.state(), update.targetUrl(), update.description()));
        log.debug("{} on {}: {}", update.context(), update.sha(), update.state());
        return commits.save(c);
    }

    @Transactional
    public CommitEntity findOrCreate(String sha) {
        return commits.findBySha(sha).orElseGet(() -> commits.save(new CommitEntity(sha)));
    }

    /**
     * Flags the commit for re-validation, creating it if it was never seen.
     */
    @Transactional
    public void markToCheck(String sha) {
        CommitEntity c = findOrCreate(sha);
        c.setToCheck(true);
        commits.save(c);
    }

    @Transactional(readOnly = true)
    public Map<String, CommitStatus> statusesOf(String sha) {
        return commits.findBySha(sha)
                .map(CommitEntity::getStatuses)
                .orElse(Map.of());
    }
}
