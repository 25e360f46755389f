package io.newsdigest.pipeline.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record IngestionRun(
        @JsonProperty("run_id") String runId,
        @JsonProperty("status") Status status,
        @JsonProperty("trigger") String trigger,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("report") IngestionReport report
) {
    public enum Status { RUNNING, COMPLETED, FAILED }

    public static IngestionRun running(String runId, String trigger, Instant startedAt) {
        return new IngestionRun(runId, Status.RUNNING, trigger, startedAt, null);
    }

    public IngestionRun finished(IngestionReport report) {
        Status status = report.fatalError() == null ? Status.COMPLETED : Status.FAILED;
        return new IngestionRun(runId, status, trigger, startedAt, report);
    }

    public boolean isActive() {
        return status == Status.RUNNING;
    }
}
