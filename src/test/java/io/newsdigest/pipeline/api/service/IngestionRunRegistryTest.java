package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.IngestionReport;
import io.newsdigest.pipeline.api.dto.IngestionRun;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IngestionRunRegistryTest {

    private final IngestionRunRegistry registry = new IngestionRunRegistry();

    @Test
    @DisplayName("Should replace a running entry with its finished state")
    void shouldUpdateRunInPlace() {
        IngestionRun run = IngestionRun.running("run-1", "manual", Instant.now());
        registry.record(run);
        registry.record(run.finished(IngestionReport.of("run-1", run.startedAt(), Instant.now(), Map.of(), "store down")));

        assertThat(registry.recent()).hasSize(1);
        assertThat(registry.find("run-1")).get().extracting(IngestionRun::status).isEqualTo(IngestionRun.Status.FAILED);
    }

    @Test
    @DisplayName("Should keep only the most recent runs, newest first")
    void shouldEvictOldestRuns() {
        for (int i = 0; i < IngestionRunRegistry.MAX_RUNS + 5; i++) {
            registry.record(IngestionRun.running("run-" + i, "scheduled", Instant.now()));
        }

        assertThat(registry.recent()).hasSize(IngestionRunRegistry.MAX_RUNS);
        assertThat(registry.recent().get(0).runId()).isEqualTo("run-" + (IngestionRunRegistry.MAX_RUNS + 4));
        assertThat(registry.find("run-0")).isEmpty();
    }
}
