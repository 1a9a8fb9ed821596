package com.mergeline.backend.sweep;

import com.mergeline.backend.outbox.FeedbackTemplate;
import com.mergeline.backend.outbox.Outbox;
import com.mergeline.backend.pr.MergeMethod;
import com.mergeline.backend.pr.PullRequestEntity;
import com.mergeline.backend.pr.PullRequestMentions;
import com.mergeline.backend.pr.PullRequestRepository;
import com.mergeline.backend.pr.PullRequestState;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One-time warnings for PRs which are ready but can't be staged: a linked
 * PR is not ready, or no merge method was chosen for a multi-commit PR.
 */
@Component
public class LinkedPullRequestNotifier {

    private final PullRequestRepository prs;
    private final PullRequestMentions mentions;
    private final Outbox outbox;

    public LinkedPullRequestNotifier(PullRequestRepository prs, PullRequestMentions mentions, Outbox outbox) {
        this.prs = prs;
        this.mentions = mentions;
        this.outbox = outbox;
    }

    @Transactional
    public void sweep() {
        List<PullRequestEntity> live = prs.findByStateNotIn(List.of(PullRequestState.MERGED, PullRequestState.CLOSED));

        Map<Long, List<PullRequestEntity>> byBatch = live.stream()
                .filter(p -> p.getBatchId() != null)
                .collect(Collectors.groupingBy(PullRequestEntity::getBatchId, LinkedHashMap::new, Collectors.toList()));

        for (List<PullRequestEntity> batch : byBatch.values()) {
            boolean pendingWarning = batch.stream().anyMatch(p -> p.getState() == PullRequestState.READY && !p.isLinkWarned());
            boolean someUnready = batch.stream().anyMatch(p -> p.getState() != PullRequestState.READY);
            if (!pendingWarning || !someUnready) continue;

            String siblings = batch.stream()
                    .filter(p -> p.getState() != PullRequestState.READY)
                    .sorted(Comparator.comparing(PullRequestEntity::getRepositoryName).thenComparingInt(PullRequestEntity::getNumber))
                    .map(PullRequestEntity::displayName)
                    .collect(Collectors.joining(", "));
            for (PullRequestEntity ready : batch) {
                if (ready.getState() != PullRequestState.READY) continue;
                outbox.comment(ready.getRepositoryId(), ready.getNumber(), FeedbackTemplate.LINKED_NOT_READY,
                        mentions.ping(ready), siblings);
                ready.setLinkWarned(true);
            }
        }

        String methods = methodList();
        for (PullRequestEntity pr : live) {
            if (pr.getState() != PullRequestState.READY || pr.hasMergeMethod() || pr.isMethodWarned()) continue;
            outbox.comment(pr.getRepositoryId(), pr.getNumber(), FeedbackTemplate.MERGE_METHOD_MISSING,
                    mentions.ping(pr), methods);
            pr.setMethodWarned(true);
        }
    }

    static String methodList() {
        StringBuilder sb = new StringBuilder();
        for (MergeMethod m : MergeMethod.values()) {
            if (m == MergeMethod.SQUASH) continue;
            sb.append("* `").append(m.code()).append("` to ").append(m.description()).append('\n');
        }
        return sb.toString();
    }
}
