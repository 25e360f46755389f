package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.Set;

/**
 * Replaces every tag assignment of a feed; an empty set clears them.
 */
public record FeedTagsRequest(
        @JsonProperty("tag_ids") @NotNull Set<Long> tagIds
) {}
