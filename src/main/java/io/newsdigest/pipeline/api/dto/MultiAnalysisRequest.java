package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record MultiAnalysisRequest(
        @JsonProperty("article_ids") @NotNull List<Long> articleIds,
        @JsonProperty("focus") @Size(max = 500) String focus,
        @JsonProperty("force") boolean force
) {}
