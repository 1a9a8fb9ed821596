package com.mergeline.backend.pr;

/**
 * A pull request as first seen on the remote.
 *
 * @param commits number of commits in the PR, a single commit is squashed
 */
public record NewPullRequest(
        String repository,
        int number,
        String target,
        String label,
        String head,
        String author,
        int commits,
        String message,
        boolean draft,
        boolean closed
) {}
