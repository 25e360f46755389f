package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ReadingListRequest(
        @JsonProperty("article_id") @NotNull Long articleId,
        @JsonProperty("notes") @Size(max = 2000) String notes
) {}
