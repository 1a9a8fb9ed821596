package com.mergeline.backend.acl;

import com.mergeline.backend.pr.PullRequestEntity;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Single place where review, authorship and override rights are decided.
 */
@Service
public class AccessPolicy {

    private final ReviewRightRepository reviewRights;
    private final OverrideRightRepository overrideRights;

    public AccessPolicy(ReviewRightRepository reviewRights, OverrideRightRepository overrideRights) {
        this.reviewRights = reviewRights;
        this.overrideRights = overrideRights;
    }

    public Acl acl(PartnerEntity user, PullRequestEntity pr) {
        if (user == null || pr == null) return Acl.NONE;

        boolean selfAuthored = Objects.equals(pr.getAuthorId(), user.getId());
        // reviewing your own PR needs an explicit self-review grant
        long grants = selfAuthored
                ? reviewRights.countByPartnerIdAndRepositoryIdAndSelfReviewTrue(user.getId(), pr.getRepositoryId())
                : reviewRights.countByPartnerIdAndRepositoryIdAndReviewTrue(user.getId(), pr.getRepositoryId());

        boolean isAdmin = grants == 1;
        boolean isReviewer = isAdmin || pr.getDelegateIds().contains(user.getId());
        boolean isAuthor = isReviewer || selfAuthored;
        return new Acl(isAdmin, isReviewer, isAuthor);
    }

    public boolean can(PartnerEntity user, Permission permission, PullRequestEntity pr) {
        Acl acl = acl(user, pr);
        return switch (permission) {
            case ADMIN -> acl.isAdmin();
            case REVIEW -> acl.isReviewer();
            case AUTHOR -> acl.isAuthor();
        };
    }

    public boolean canOverride(PartnerEntity user, String context, Long repositoryId) {
        if (user == null) return false;
        return overrideRights.findByPartnerId(user.getId()).stream()
                .filter(r -> r.appliesTo(repositoryId))
                .anyMatch(r -> r.getContext().equals(context));
    }

    public boolean hasAnyOverrideRight(PartnerEntity user) {
        return user != null && !overrideRights.findByPartnerId(user.getId()).isEmpty();
    }
}
