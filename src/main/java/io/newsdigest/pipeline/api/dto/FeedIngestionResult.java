package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Counters for one feed in one run. {@code skipped} counts entries left unprocessed once the run's article cap was hit.
 */
public record FeedIngestionResult(
        @JsonProperty("feed_name") String feedName,
        @JsonProperty("fetched") int fetched,
        @JsonProperty("new") int created,
        @JsonProperty("duplicate") int duplicate,
        @JsonProperty("rejected") int rejected,
        @JsonProperty("failed") int failed,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("indexed") int indexed,
        @JsonProperty("errors") List<FeedFetchError> errors
) {
    public static FeedIngestionResult failed(String feedName, FeedFetchError error) {
        return new FeedIngestionResult(feedName, 0, 0, 0, 0, 0, 0, 0, List.of(error));
    }

    public FeedIngestionResult withIndexed(int indexed) {
        return new FeedIngestionResult(feedName, fetched, created, duplicate, rejected, failed, skipped, indexed, errors);
    }
}
