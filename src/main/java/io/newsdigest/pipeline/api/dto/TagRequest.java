package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * Body of tag create and update calls; null fields are left unchanged on update.
 */
public record TagRequest(
        @JsonProperty("name") @Size(max = 64) String name,
        @JsonProperty("description") @Size(max = 500) String description,
        @JsonProperty("color") String color
) {}
