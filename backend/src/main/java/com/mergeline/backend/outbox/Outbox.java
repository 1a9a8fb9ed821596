package com.mergeline.backend.outbox;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Enqueues work for the delivery worker: comments, closes, tag changes and
 * re-fetches. Nothing here talks to the remote.
 */
@Service
public class Outbox {

    private final FeedbackRepository feedback;
    private final TaggingRepository tagging;
    private final FetchJobRepository fetchJobs;

    public Outbox(FeedbackRepository feedback, TaggingRepository tagging, FetchJobRepository fetchJobs) {
        this.feedback = feedback;
        this.tagging = tagging;
        this.fetchJobs = fetchJobs;
    }

    @Transactional
    public FeedbackEntity comment(Long repositoryId, int number, String message) {
        return feedback.save(new FeedbackEntity(repositoryId, number, message, false));
    }

    @Transactional
    public FeedbackEntity comment(Long repositoryId, int number, FeedbackTemplate template, Object... args) {
        return comment(repositoryId, number, template.render(args));
    }

    @Transactional
    public FeedbackEntity close(Long repositoryId, int number, String message) {
        return feedback.save(new FeedbackEntity(repositoryId, number, message, true));
    }

    @Transactional
    public TaggingEntity changeTags(Long repositoryId, int number, Collection<String> remove, Collection<String> add) {
        return tagging.save(new TaggingEntity(repositoryId, number, List.copyOf(remove), List.copyOf(add)));
    }

    /**
     * Queues a re-fetch of the PR unless one is already waiting.
     */
    @Transactional
    public void fetch(Long repositoryId, int number, boolean closing) {
        if (fetchJobs.existsByRepositoryIdAndPullRequestAndActiveTrue(repositoryId, number)) return;
        fetchJobs.save(new FetchJobEntity(repositoryId, number, closing));
    }
}
