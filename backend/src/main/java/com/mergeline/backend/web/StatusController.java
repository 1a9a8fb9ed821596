package com.mergeline.backend.web;

import com.mergeline.backend.commit.CommitEntity;
import com.mergeline.backend.commit.CommitService;
import com.mergeline.backend.commit.StatusUpdate;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Entry point for normalized CI status updates.
 */
@RestController
@RequestMapping("/api/statuses")
public class StatusController {

    private final CommitService commits;

    public StatusController(CommitService commits) {
        this.commits = commits;
    }

    @PostMapping
    public Map<String, Object> record(@RequestBody StatusUpdate update) {
        CommitEntity c = commits.recordStatus(update);
        return Map.of("status", "ok", "sha", c.getSha());
    }
}
