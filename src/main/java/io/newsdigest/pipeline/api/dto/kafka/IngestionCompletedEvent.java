package io.newsdigest.pipeline.api.dto.kafka;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record IngestionCompletedEvent(
        @JsonProperty("runId") String runId,
        @JsonProperty("feeds") int feeds,
        @JsonProperty("totalFetched") int totalFetched,
        @JsonProperty("newArticles") int newArticles,
        @JsonProperty("duplicates") int duplicates,
        @JsonProperty("errors") int errors,
        @JsonProperty("processingDurationMs") long processingDurationMs,
        @JsonProperty("completedAt") Instant completedAt
) {
    public static IngestionCompletedEvent create(String runId, int feeds, int totalFetched, int newArticles,
                                                 int duplicates, int errors, long processingDurationMs) {
        return new IngestionCompletedEvent(runId, feeds, totalFetched, newArticles, duplicates, errors,
                processingDurationMs, Instant.now());
    }
}
