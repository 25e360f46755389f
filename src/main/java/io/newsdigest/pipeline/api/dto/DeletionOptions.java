package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeletionOptions(
        @JsonProperty("delete_summaries") boolean deleteSummaries,
        @JsonProperty("delete_from_vector_store") boolean deleteFromVectorStore
) {
    public static DeletionOptions everything() {
        return new DeletionOptions(true, true);
    }
}
