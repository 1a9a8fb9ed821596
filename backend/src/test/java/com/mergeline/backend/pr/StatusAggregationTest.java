package com.mergeline.backend.pr;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import org.junit.jupiter.api.Test;

import com.mergeline.backend.commit.CiState;
import com.mergeline.backend.commit.CommitStatus;

public class StatusAggregationTest {

    private static CommitStatus st(CiState state) {
        return new CommitStatus(state, null, null);
    }

    @Test
    void failure_whenAnyRequiredContextFails() {
        Map<String, CommitStatus> statuses = Map.of(
                "ci", st(CiState.SUCCESS),
                "lint", st(CiState.FAILURE)
        );

        assertEquals(AggregateStatus.FAILURE, StatusAggregation.aggregate(statuses, List.of("ci", "lint")));
    }

    @Test
    void failure_winsOverMissingContext() {
        Map<String, CommitStatus> statuses = Map.of("lint", st(CiState.ERROR));

        assertEquals(AggregateStatus.FAILURE, StatusAggregation.aggregate(statuses, List.of("ci", "lint")));
    }

    @Test
    void pending_whenRequiredContextMissingOrPending() {
        assertEquals(AggregateStatus.PENDING,
                StatusAggregation.aggregate(Map.of("ci", st(CiState.SUCCESS)), List.of("ci", "lint")));
        assertEquals(AggregateStatus.PENDING,
                StatusAggregation.aggregate(Map.of("ci", st(CiState.PENDING)), List.of("ci")));
    }

    @Test
    void success_ignoresContextsWhichAreNotRequired() {
        Map<String, CommitStatus> statuses = Map.of(
                "ci", st(CiState.SUCCESS),
                "coverage", st(CiState.FAILURE)
        );

        assertEquals(AggregateStatus.SUCCESS, StatusAggregation.aggregate(statuses, List.of("ci")));
        assertEquals(AggregateStatus.SUCCESS, StatusAggregation.aggregate(Map.of(), List.of()));
    }

    @Test
    void effective_nearerOverridesWin() {
        Map<String, CommitStatus> raw = Map.of("ci", st(CiState.FAILURE), "lint", st(CiState.FAILURE));
        Map<String, CommitStatus> root = Map.of(
                "ci", new CommitStatus(CiState.SUCCESS, "http://root", null),
                "lint", new CommitStatus(CiState.SUCCESS, "http://root", null)
        );
        Map<String, CommitStatus> self = Map.of("lint", new CommitStatus(CiState.SUCCESS, "http://self", null));

        Map<String, CommitStatus> out = StatusAggregation.effective(raw, List.of(root, self));

        assertEquals("http://root", out.get("ci").targetUrl());
        assertEquals("http://self", out.get("lint").targetUrl());
        assertEquals(AggregateStatus.SUCCESS, StatusAggregation.aggregate(out, List.of("ci", "lint")));
    }

    @Test
    void firstFailing_followsStatusOrderAndSkipsOptionalContexts() {
        Map<String, CommitStatus> statuses = new LinkedHashMap<>();
        statuses.put("coverage", st(CiState.FAILURE));
        statuses.put("lint", st(CiState.ERROR));
        statuses.put("ci", st(CiState.FAILURE));

        assertEquals("lint", StatusAggregation.firstFailing(statuses, List.of("ci", "lint")));
        assertNull(StatusAggregation.firstFailing(Map.of("ci", st(CiState.SUCCESS)), List.of("ci")));
    }
}
