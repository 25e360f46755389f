package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.newsdigest.pipeline.model.Tag;

import java.time.Instant;

public record TagView(
        @JsonProperty("id") long id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("color") String color,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {
    public static TagView of(Tag tag) {
        return new TagView(tag.getId(), tag.getName(), tag.getDescription(), tag.getColor(),
                tag.getCreatedAt(), tag.getUpdatedAt());
    }
}
