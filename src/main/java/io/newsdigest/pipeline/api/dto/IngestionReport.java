package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Per-run outcome keyed by feed URL, plus totals across feeds.
 */
public record IngestionReport(
        @JsonProperty("run_id") String runId,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("feeds") Map<String, FeedIngestionResult> feeds,
        @JsonProperty("total_fetched") int totalFetched,
        @JsonProperty("total_new") int totalNew,
        @JsonProperty("total_duplicate") int totalDuplicate,
        @JsonProperty("total_errors") int totalErrors,
        @JsonProperty("fatal_error") String fatalError
) {
    public static IngestionReport of(String runId, Instant startedAt, Instant finishedAt,
                                     Map<String, FeedIngestionResult> feeds, String fatalError) {
        int fetched = 0, created = 0, duplicate = 0, errors = 0;
        for (FeedIngestionResult result : feeds.values()) {
            fetched += result.fetched();
            created += result.created();
            duplicate += result.duplicate();
            errors += result.errors().size();
        }
        return new IngestionReport(runId, startedAt, finishedAt, Map.copyOf(feeds),
                fetched, created, duplicate, errors, fatalError);
    }

    public FeedIngestionResult feed(String url) {
        return feeds.get(url);
    }
}
