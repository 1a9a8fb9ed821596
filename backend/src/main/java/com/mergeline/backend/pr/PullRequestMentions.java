package com.mergeline.backend.pr;

import com.mergeline.backend.acl.PartnerEntity;
import com.mergeline.backend.acl.PartnerRepository;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Renders the "@author @reviewer " prefix of feedback messages. Forward-port
 * copies ping the people responsible for the source PR.
 */
@Component
public class PullRequestMentions {

    private final PartnerRepository partners;
    private final PullRequestRepository prs;

    public PullRequestMentions(PartnerRepository partners, PullRequestRepository prs) {
        this.partners = partners;
        this.prs = prs;
    }

    public String ping(PullRequestEntity pr) {
        PullRequestEntity origin = pr;
        if (pr.getSourceId() != null) {
            origin = prs.findById(pr.getSourceId()).orElse(pr);
        }

        Set<String> logins = new LinkedHashSet<>();
        addLogin(logins, origin.getAuthorId());
        addLogin(logins, origin.getReviewedById());
        if (logins.isEmpty()) return "";

        StringBuilder sb = new StringBuilder();
        for (String login : logins) sb.append('@').append(login).append(' ');
        return sb.toString();
    }

    private void addLogin(Set<String> logins, Long partnerId) {
        if (partnerId == null) return;
        partners.findById(partnerId).map(PartnerEntity::getLogin).ifPresent(logins::add);
    }
}
