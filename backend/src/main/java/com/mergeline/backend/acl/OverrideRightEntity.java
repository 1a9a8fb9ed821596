package com.mergeline.backend.acl;

import jakarta.persistence.*;

/**
 * Grants a partner the right to force a CI context to success. A null
 * repository means the grant applies everywhere.
 */
@Entity
@Table(name = "override_rights")
public class OverrideRightEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "partner_id", nullable = false)
    private Long partnerId;

    @Column(name = "repository_id")
    private Long repositoryId;

    @Column(nullable = false)
    private String context;

    protected OverrideRightEntity() {}

    public OverrideRightEntity(Long partnerId, Long repositoryId, String context) {
        this.partnerId = partnerId;
        this.repositoryId = repositoryId;
        this.context = context;
    }

    public Long getId() { return id; }
    public Long getPartnerId() { return partnerId; }
    public Long getRepositoryId() { return repositoryId; }
    public String getContext() { return context; }

    public boolean appliesTo(Long repositoryId) {
        return this.repositoryId == null || this.repositoryId.equals(repositoryId);
    }
}
