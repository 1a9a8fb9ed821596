package com.mergeline.backend.staging;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RenderedStatus(
        @JsonProperty("repository") String repository,
        @JsonProperty("context") String context,
        @JsonProperty("state") String state,
        @JsonProperty("target_url") String targetUrl
) {}
