package com.mergeline.backend.pr;

import com.mergeline.backend.commit.CiState;
import com.mergeline.backend.commit.CommitStatus;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure functions turning raw CI statuses into an aggregate verdict.
 */
public final class StatusAggregation {

    private StatusAggregation() {}

    /**
     * Any failing required context wins, then any missing or pending one,
     * otherwise success. Contexts that are not required are ignored.
     */
    public static AggregateStatus aggregate(Map<String, CommitStatus> statuses, Collection<String> required) {
        AggregateStatus result = AggregateStatus.SUCCESS;
        for (String ctx : required) {
            CommitStatus st = statuses.getOrDefault(ctx, CommitStatus.MISSING);
            if (st.state().isFailing()) return AggregateStatus.FAILURE;
            if (st.state() == CiState.PENDING) result = AggregateStatus.PENDING;
        }
        return result;
    }

    /**
     * Merges override layers on top of raw statuses. Layers are ordered from
     * the farthest ancestor to the PR itself, so nearer overrides win.
     */
    public static Map<String, CommitStatus> effective(Map<String, CommitStatus> raw,
                                                      List<Map<String, CommitStatus>> overrideLayers) {
        Map<String, CommitStatus> out = new LinkedHashMap<>(raw);
        for (Map<String, CommitStatus> layer : overrideLayers) {
            out.putAll(layer);
        }
        return out;
    }

    /**
     * First required context currently failing, in the insertion order of
     * the status map, or null.
     */
    public static String firstFailing(Map<String, CommitStatus> statuses, Collection<String> required) {
        for (Map.Entry<String, CommitStatus> e : statuses.entrySet()) {
            if (required.contains(e.getKey()) && e.getValue().state().isFailing()) {
                return e.getKey();
            }
        }
        return null;
    }
}
