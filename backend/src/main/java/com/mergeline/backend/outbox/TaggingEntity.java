package com.mergeline.backend.outbox;

import jakarta.persistence.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "taggings")
public class TaggingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "repository_id", nullable = false)
    private Long repositoryId;

    @Column(name = "pr_number", nullable = false)
    private int pullRequest;

    @Convert(converter = StringListConverter.class)
    @Column(name = "tags_remove", nullable = false, columnDefinition = "text")
    private List<String> tagsRemove = new ArrayList<>();

    @Convert(converter = StringListConverter.class)
    @Column(name = "tags_add", nullable = false, columnDefinition = "text")
    private List<String> tagsAdd = new ArrayList<>();

    protected TaggingEntity() {}

    public TaggingEntity(Long repositoryId, int pullRequest, List<String> tagsRemove, List<String> tagsAdd) {
        this.repositoryId = repositoryId;
        this.pullRequest = pullRequest;
        this.tagsRemove = new ArrayList<>(tagsRemove);
        this.tagsAdd = new ArrayList<>(tagsAdd);
    }

    public Long getId() { return id; }
    public Long getRepositoryId() { return repositoryId; }
    public int getPullRequest() { return pullRequest; }
    public List<String> getTagsRemove() { return List.copyOf(tagsRemove); }
    public List<String> getTagsAdd() { return List.copyOf(tagsAdd); }
}
