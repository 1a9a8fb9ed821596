package com.mergeline.backend.pr;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Labels put on remote pull requests to mirror their state.
 */
public final class PullRequestTags {

    public static final String SEEN = "seen";
    public static final String CI = "CI";
    public static final String REVIEWED = "r+";
    public static final String STAGED = "merging";
    public static final String MERGED = "merged";
    public static final String ERROR = "error";
    public static final String CLOSED = "closed";

    public static final List<String> ALL = List.of(SEEN, CI, REVIEWED, STAGED, MERGED, ERROR, CLOSED);

    private static final Map<PullRequestState, Set<String>> BY_STATE = new EnumMap<>(PullRequestState.class);

    static {
        BY_STATE.put(PullRequestState.OPENED, Set.of(SEEN));
        BY_STATE.put(PullRequestState.VALIDATED, Set.of(SEEN, CI));
        BY_STATE.put(PullRequestState.APPROVED, Set.of(SEEN, REVIEWED));
        BY_STATE.put(PullRequestState.READY, Set.of(SEEN, CI, REVIEWED));
        BY_STATE.put(PullRequestState.MERGED, Set.of(SEEN, CI, REVIEWED, MERGED));
        BY_STATE.put(PullRequestState.ERROR, Set.of(SEEN, ERROR));
        BY_STATE.put(PullRequestState.CLOSED, Set.of(SEEN, CLOSED));
    }

    private PullRequestTags() {}

    public static List<String> forState(PullRequestState state) {
        return sorted(BY_STATE.get(state));
    }

    public static List<String> staged() {
        Set<String> tags = new LinkedHashSet<>(BY_STATE.get(PullRequestState.READY));
        tags.add(STAGED);
        return sorted(tags);
    }

    private static List<String> sorted(Set<String> tags) {
        return ALL.stream().filter(tags::contains).toList();
    }
}
