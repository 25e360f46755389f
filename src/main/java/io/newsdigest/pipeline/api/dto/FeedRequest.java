package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

import java.util.Set;

/**
 * Body of feed create and update calls; null fields are left unchanged on update.
 */
public record FeedRequest(
        @JsonProperty("name") @Size(max = 200) String name,
        @JsonProperty("url") @Size(max = 1000) String url,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("tag_ids") Set<Long> tagIds
) {}
