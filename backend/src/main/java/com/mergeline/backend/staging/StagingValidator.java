package com.mergeline.backend.staging;

import com.mergeline.backend.commit.CiState;
import com.mergeline.backend.commit.CommitStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Aggregates CI results over every head of a staging.
 */
public final class StagingValidator {

    private StagingValidator() {}

    /**
     * Statuses reported on one staging head and the contexts it needs.
     */
    public record HeadStatuses(Map<String, CommitStatus> statuses, Collection<String> required) {}

    /**
     * @param rearm whether the timeout deadline should be pushed back: a
     *              required context explicitly reported pending and the
     *              staging did not fail
     */
    public record Verdict(StagingState state, boolean rearm) {}

    public static Verdict validate(List<HeadStatuses> heads) {
        StagingState state = StagingState.SUCCESS;
        boolean sawPending = false;
        for (HeadStatuses head : heads) {
            for (String ctx : head.required()) {
                CommitStatus st = head.statuses().get(ctx);
                if (state == StagingState.FAILURE || (st != null && st.state().isFailing())) {
                    state = StagingState.FAILURE;
                } else if (st == null) {
                    // never reported: keep waiting but leave the deadline alone
                    state = StagingState.PENDING;
                } else if (st.state() == CiState.PENDING) {
                    state = StagingState.PENDING;
                    sawPending = true;
                }
            }
        }
        return new Verdict(state, sawPending && state != StagingState.FAILURE);
    }
}
