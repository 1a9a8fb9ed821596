package com.mergeline.backend.registry;

import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resolves which CI contexts gate a pull request or a staging, for a given
 * repository and target branch.
 */
@Service
public class RequiredContexts {

    private final StatusRequirementRepository requirements;

    public RequiredContexts(StatusRequirementRepository requirements) {
        this.requirements = requirements;
    }

    public List<String> forPullRequest(Long repositoryId, BranchEntity target) {
        return requirements.findByRepositoryIdOrderById(repositoryId).stream()
                .filter(StatusRequirementEntity::isPrs)
                .filter(r -> r.appliesTo(target))
                .map(StatusRequirementEntity::getContext)
                .distinct()
                .toList();
    }

    public List<String> forStaging(Long repositoryId, BranchEntity target) {
        return requirements.findByRepositoryIdOrderById(repositoryId).stream()
                .filter(StatusRequirementEntity::isStagings)
                .filter(r -> r.appliesTo(target))
                .map(StatusRequirementEntity::getContext)
                .distinct()
                .toList();
    }
}
