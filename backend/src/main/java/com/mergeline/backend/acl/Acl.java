package com.mergeline.backend.acl;

/**
 * Rights of one user on one pull request. Each level implies the next:
 * an admin is a reviewer, a reviewer is treated as an author.
 */
public record Acl(boolean isAdmin, boolean isReviewer, boolean isAuthor) {

    public static final Acl NONE = new Acl(false, false, false);
}
