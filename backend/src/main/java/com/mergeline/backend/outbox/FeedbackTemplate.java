package com.mergeline.backend.outbox;

/**
 * User-facing messages posted on pull requests. Placeholders are positional
 * {@link String#format} arguments.
 */
public enum FeedbackTemplate {
    PR_TRACKED("Pull request %s is tracked by the merge queue."),
    STAGING_FAILED("%sstaging failed: %s"),
    CI_FAILED_APPROVED("%s%s failed on this reviewed PR."),
    APPROVE_FAILED_CI("@%s you may want to rebuild or fix this PR as it has failed CI."),
    ACCESS_DENIED("@%s you are not allowed to issue commands on %s."),
    UNAPPROVE_SKIPCHECKS("@%s skipchecks removed due to r-."),
    MERGE_METHOD_SET("Merge method set to %s."),
    BRANCH_DISABLED("%sthe target branch %s has been disabled, you may want to close this PR."),
    LINKED_NOT_READY("%slinked pull request(s) %s not ready. Linked PRs are not staged until all of them are ready."),
    MERGE_METHOD_MISSING("%sbecause this PR has multiple commits, I need to know how to merge it:\n\n%s"),
    FW_DEFAULT("Waiting for CI to create followup forward-ports."),
    FW_SKIPCI("Not waiting for CI to create followup forward-ports."),
    FW_SKIPMERGE("Not waiting for merge to create followup forward-ports."),
    FW_LIMIT_SET("Forward-porting to %s.");

    private final String pattern;

    FeedbackTemplate(String pattern) {
        this.pattern = pattern;
    }

    public String render(Object... args) {
        return String.format(pattern, args);
    }
}
