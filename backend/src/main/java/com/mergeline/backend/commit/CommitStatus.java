package com.mergeline.backend.commit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommitStatus(
        @JsonProperty("state") CiState state,
        @JsonProperty("target_url") String targetUrl,
        @JsonProperty("description") String description
) {
    public static final CommitStatus MISSING = new CommitStatus(CiState.PENDING, null, null);

    public CommitStatus {
        if (state == null) state = CiState.PENDING;
    }

    /**
     * Same state and same url. Descriptions tend to change between reports
     * of the same run and are ignored.
     */
    public boolean equivalentTo(CommitStatus other) {
        return other != null
                && state == other.state
                && Objects.equals(targetUrl, other.targetUrl);
    }
}
