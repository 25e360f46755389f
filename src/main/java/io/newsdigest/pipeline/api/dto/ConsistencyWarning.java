package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Drift between the article store and the vector index left behind by a partially failed operation.
 */
public record ConsistencyWarning(
        @JsonProperty("message") String message,
        @JsonProperty("orphaned_vector_records") int orphanedVectorRecords
) {}
