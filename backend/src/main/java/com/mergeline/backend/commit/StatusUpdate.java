package com.mergeline.backend.commit;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized CI report, as produced by the webhook layer.
 */
public record StatusUpdate(
        String sha,
        String context,
        CiState state,
        @JsonProperty("target_url") String targetUrl,
        String description
) {
    public StatusUpdate(String sha, String context, CiState state, String targetUrl) {
        this(sha, context, state, targetUrl, null);
    }
}
