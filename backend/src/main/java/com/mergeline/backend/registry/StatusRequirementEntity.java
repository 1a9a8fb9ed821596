package com.mergeline.backend.registry;

import jakarta.persistence.*;

/**
 * A CI context that must be green before a pull request or a staging of
 * the owning repository is accepted.
 */
@Entity
@Table(name = "status_requirements")
public class StatusRequirementEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String context;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    // regex on the branch name, null or blank applies to every branch
    @Column(name = "branch_filter")
    private String branchFilter;

    @Column(name = "applies_to_prs", nullable = false)
    private boolean prs = true;

    @Column(name = "applies_to_stagings", nullable = false)
    private boolean stagings = true;

    protected StatusRequirementEntity() {}

    public StatusRequirementEntity(Long repositoryId, String context) {
        this.repositoryId = repositoryId;
        this.context = context;
    }

    public Long getId() { return id; }

    public String getContext() { return context; }
    public void setContext(String context) { this.context = context; }

    public Long getRepositoryId() { return repositoryId; }
    public void setRepositoryId(Long repositoryId) { this.repositoryId = repositoryId; }

    public String getBranchFilter() { return branchFilter; }
    public void setBranchFilter(String branchFilter) { this.branchFilter = branchFilter; }

    public boolean isPrs() { return prs; }
    public void setPrs(boolean prs) { this.prs = prs; }

    public boolean isStagings() { return stagings; }
    public void setStagings(boolean stagings) { this.stagings = stagings; }

    public boolean appliesTo(BranchEntity branch) {
        if (branchFilter == null || branchFilter.isBlank()) return true;
        return branch.getName().matches(branchFilter);
    }
}
