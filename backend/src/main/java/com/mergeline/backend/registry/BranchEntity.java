package com.mergeline.backend.registry;

import jakarta.persistence.*;

@Entity
@Table(name = "branches")
public class BranchEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "staging_enabled", nullable = false)
    private boolean stagingEnabled = true;

    @Column(nullable = false)
    private int sequence;

    protected BranchEntity() {}

    public BranchEntity(String name) {
        this.name = name;
    }

    public Long getId() { return id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }

    public boolean isStagingEnabled() { return stagingEnabled; }
    public void setStagingEnabled(boolean stagingEnabled) { this.stagingEnabled = stagingEnabled; }

    public int getSequence() { return sequence; }
    public void setSequence(int sequence) { this.sequence = sequence; }

    public String displayName() {
        return active ? name : name + " (inactive)";
    }
}
