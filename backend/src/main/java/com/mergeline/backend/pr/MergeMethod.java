package com.mergeline.backend.pr;

import java.util.Arrays;
import java.util.Optional;

public enum MergeMethod {
    MERGE("merge", "merge directly, using the PR as merge commit message"),
    REBASE_MERGE("rebase-merge", "rebase and merge, using the PR as merge commit message"),
    REBASE_FF("rebase-ff", "rebase and fast-forward"),
    SQUASH("squash", "squash");

    private final String code;
    private final String description;

    MergeMethod(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String code() { return code; }
    public String description() { return description; }

    public static Optional<MergeMethod> fromCode(String code) {
        return Arrays.stream(values()).filter(m -> m.code.equals(code)).findFirst();
    }
}
