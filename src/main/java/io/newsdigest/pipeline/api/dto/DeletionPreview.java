package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.SortedMap;

public record DeletionPreview(
        @JsonProperty("count") long count,
        @JsonProperty("by_source") SortedMap<String, Long> bySource,
        @JsonProperty("filters_applied") Map<String, Object> filtersApplied
) {}
