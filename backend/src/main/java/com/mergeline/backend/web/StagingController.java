package com.mergeline.backend.web;

import com.mergeline.backend.staging.RenderedStatus;
import com.mergeline.backend.staging.StagingEntity;
import com.mergeline.backend.staging.StagingRepository;
import com.mergeline.backend.staging.StagingService;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/stagings")
public class StagingController {

    private final StagingRepository stagings;
    private final StagingService service;

    public StagingController(StagingRepository stagings, StagingService service) {
        this.stagings = stagings;
        this.service = service;
    }

    public record StagingView(
            Long id,
            Long targetId,
            String state,
            boolean active,
            Instant stagedAt,
            Instant timeoutLimit,
            String reason,
            List<Long> batchIds,
            List<RenderedStatus> statuses
    ) {}

    @GetMapping("/{stagingId}")
    public StagingView get(@PathVariable Long stagingId) {
        StagingEntity s = stagings.findById(stagingId)
                .orElseThrow(() -> new IllegalArgumentException("Staging not found: " + stagingId));
        return new StagingView(s.getId(), s.getTargetId(), s.getState().code(), s.isActive(), s.getStagedAt(),
                s.getTimeoutLimit(), s.getReason(), s.getBatchIds(), service.statuses(stagingId));
    }

    @PostMapping("/{stagingId}/cancel")
    public Map<String, Object> cancel(
            @PathVariable Long stagingId,
            @RequestHeader(value = "X-User", defaultValue = "operator") String user
    ) {
        boolean cancelled = service.cancel(stagingId, "Cancelled by " + user);
        return Map.of("status", "ok", "stagingId", stagingId, "cancelled", cancelled);
    }
}
