package com.mergeline.backend.registry;

import jakarta.persistence.*;

@Entity
@Table(name = "repositories")
public class RepositoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(nullable = false)
    private int sequence = 50;

    // sed-style rules, one per line, applied to incoming labels
    @Column(columnDefinition = "text")
    private String substitutions;

    protected RepositoryEntity() {}

    public RepositoryEntity(String name) {
        this.name = name;
    }

    public Long getId() { return id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getSequence() { return sequence; }
    public void setSequence(int sequence) { this.sequence = sequence; }

    public String getSubstitutions() { return substitutions; }
    public void setSubstitutions(String substitutions) { this.substitutions = substitutions; }

    public String remapLabel(String label) {
        return LabelSubstitutions.parse(substitutions).apply(label);
    }
}
