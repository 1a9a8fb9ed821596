package com.mergeline.backend.command;

import com.mergeline.backend.batch.BatchPriority;
import com.mergeline.backend.batch.ForwardPortPolicy;
import com.mergeline.backend.pr.MergeMethod;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * One directive from a comment, already tokenized. {@code toString} renders
 * it back the way it is written.
 */
public interface Command {

    /**
     * @param ids PR numbers to approve along a forward-port chain, null for
     *            the current PR (or every approvable ancestor)
     */
    record Approve(List<Integer> ids) implements Command {
        public Approve() { this(null); }

        @Override
        public String toString() {
            if (ids == null) return "r+";
            return "r=" + ids.stream().map(String::valueOf).collect(Collectors.joining(","));
        }
    }

    record Reject() implements Command {
        @Override
        public String toString() { return "r-"; }
    }

    record SetMergeMethod(MergeMethod method) implements Command {
        @Override
        public String toString() { return "merge=" + method.code(); }
    }

    record Retry() implements Command {
        @Override
        public String toString() { return "retry"; }
    }

    record Check() implements Command {
        @Override
        public String toString() { return "check"; }
    }

    /**
     * @param users logins, empty to delegate to the PR's author
     */
    record Delegate(List<String> users) implements Command {
        public Delegate {
            users = users == null ? List.of() : List.copyOf(users);
        }

        @Override
        public String toString() {
            return users.isEmpty() ? "delegate+" : "delegate=" + String.join(",", users);
        }
    }

    record Priority(BatchPriority level) implements Command {
        @Override
        public String toString() { return level.name().toLowerCase(Locale.ROOT); }
    }

    record SkipChecks() implements Command {
        @Override
        public String toString() { return "skipchecks"; }
    }

    record CancelStaging() implements Command {
        @Override
        public String toString() { return "cancel=staging"; }
    }

    record OverrideStatuses(List<String> contexts) implements Command {
        public OverrideStatuses {
            contexts = List.copyOf(contexts);
        }

        @Override
        public String toString() { return "override=" + String.join(",", contexts); }
    }

    record Close() implements Command {
        @Override
        public String toString() { return "close"; }
    }

    record Fw(ForwardPortPolicy policy) implements Command {
        @Override
        public String toString() { return "fw=" + policy.name().toLowerCase(Locale.ROOT); }
    }

    /**
     * @param branch last branch to forward-port to, null for the PR's own target
     */
    record Limit(String branch) implements Command {
        @Override
        public String toString() { return branch == null ? "up to" : "up to " + branch; }
    }
}
