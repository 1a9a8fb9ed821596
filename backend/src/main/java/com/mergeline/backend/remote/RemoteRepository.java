package com.mergeline.backend.remote;

/**
 * Narrow view of a hosted repository: the branch operations needed by the
 * merge protocol. Comments, closing and tags go through the outbox and are
 * delivered by a separate worker.
 */
public interface RemoteRepository {

    String head(String branch);

    void setRef(String branch, String sha);

    /**
     * Moves {@code branch} to {@code sha} if and only if it is a descendant of
     * the current head.
     *
     * @throws FastForwardException if the branch has diverged or the call failed
     */
    void fastForward(String branch, String sha);

    String name();
}
