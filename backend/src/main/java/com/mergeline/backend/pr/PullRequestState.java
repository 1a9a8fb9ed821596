package com.mergeline.backend.pr;

public enum PullRequestState {
    OPENED,
    VALIDATED,
    APPROVED,
    READY,
    MERGED,
    ERROR,
    CLOSED;

    public boolean isTerminal() {
        return this == MERGED || this == CLOSED;
    }

    public boolean isApproved() {
        return this == APPROVED || this == READY;
    }

    /**
     * State reached by approving a PR in this state, or null when an
     * approval has no effect.
     */
    public PullRequestState afterApproval() {
        return switch (this) {
            case OPENED -> APPROVED;
            case VALIDATED -> READY;
            default -> null;
        };
    }
}
