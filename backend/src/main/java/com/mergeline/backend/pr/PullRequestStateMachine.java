package com.mergeline.backend.pr;

import com.mergeline.backend.batch.BatchEntity;

import java.util.List;
import java.util.function.Predicate;

/**
 * Derives a pull request's state and its blocked reason from its inputs.
 * Nothing here is stored as independent truth; callers persist the results
 * as a cache.
 */
public final class PullRequestStateMachine {

    private PullRequestStateMachine() {}

    public static PullRequestState state(PullRequestEntity pr, BatchEntity batch) {
        if (batch != null && batch.isMerged()) return PullRequestState.MERGED;
        if (pr.isClosed()) return PullRequestState.CLOSED;
        if (pr.isError()) return PullRequestState.ERROR;
        // skipchecks stands for both approval and green CI
        if (batch != null && batch.isSkipchecks()) return PullRequestState.READY;

        boolean reviewed = pr.isReviewed();
        boolean green = pr.getStatus() == AggregateStatus.SUCCESS;
        if (reviewed && green) return PullRequestState.READY;
        if (reviewed) return PullRequestState.APPROVED;
        if (green) return PullRequestState.VALIDATED;
        return PullRequestState.OPENED;
    }

    private record Requirement(Predicate<PullRequestEntity> check, String message) {}

    /**
     * First unmet requirement across the whole batch, attributed to the PR
     * itself or to the offending sibling. Members must be in a stable order
     * and include {@code pr}; their states must already be up to date.
     */
    public static String blocked(PullRequestEntity pr, BatchEntity batch, List<PullRequestEntity> members) {
        if (pr.getState().isTerminal()) return null;

        boolean skipchecks = batch != null && batch.isSkipchecks();
        boolean anyError = members.stream().anyMatch(m -> m.getState() == PullRequestState.ERROR);

        List<Requirement> requirements = List.of(
                new Requirement(p -> !p.isDraft(), "is in draft"),
                new Requirement(PullRequestEntity::hasMergeMethod, "has no merge method"),
                new Requirement(p -> p.getState() == PullRequestState.READY || (skipchecks && !anyError), "is not ready")
        );

        for (PullRequestEntity member : members) {
            for (Requirement r : requirements) {
                if (r.check().test(member)) continue;
                boolean self = member == pr || (pr.getId() != null && pr.getId().equals(member.getId()));
                if (self) return r.message();
                return "linked PR " + member.displayName() + " " + r.message();
            }
        }
        return null;
    }
}
