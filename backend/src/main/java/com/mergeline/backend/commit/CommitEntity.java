package com.mergeline.backend.commit;

import jakarta.persistence.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A commit onto which CI statuses get posted. Shared by every pull request
 * and staging pointing at the same sha.
 */
@Entity
@Table(name = "commits")
public class CommitEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String sha;

    @Convert(converter = StatusMapConverter.class)
    @Column(nullable = false, columnDefinition = "text")
    private Map<String, CommitStatus> statuses = new LinkedHashMap<>();

    @Column(name = "to_check", nullable = false)
    private boolean toCheck = true;

    protected CommitEntity() {}

    public CommitEntity(String sha) {
        this.sha = sha;
    }

    public Long getId() { return id; }
    public String getSha() { return sha; }

    public Map<String, CommitStatus> getStatuses() {
        return Collections.unmodifiableMap(statuses);
    }

    public void setStatuses(Map<String, CommitStatus> statuses) {
        this.statuses = new LinkedHashMap<>(statuses);
        this.toCheck = true;
    }

    public void putStatus(String context, CommitStatus status) {
        Map<String, CommitStatus> next = new LinkedHashMap<>(statuses);
        next.put(context, status);
        setStatuses(next);
    }

    public boolean isToCheck() { return toCheck; }
    public void setToCheck(boolean toCheck) { this.toCheck = toCheck; }
}
