package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.IngestionReport;
import io.newsdigest.pipeline.api.dto.IngestionRun;
import io.newsdigest.pipeline.api.exception.PipelineException;
import io.newsdigest.pipeline.api.service.IngestionCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ingestion")
public class IngestionController {

    private final IngestionCoordinator coordinator;

    public IngestionController(IngestionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Starts a background run, or returns the one already running.
     */
    @PostMapping("/runs")
    public ResponseEntity<IngestionRun> trigger(@RequestParam(name = "feed_id", required = false) Long feedId) {
        IngestionRun run = feedId == null
                ? coordinator.trigger("api")
                : coordinator.triggerFeed("api", feedId);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(run);
    }

    @PostMapping("/runs/sync")
    public IngestionReport ingestNow() {
        return coordinator.ingestNow("api-sync");
    }

    @GetMapping("/runs")
    public List<IngestionRun> recentRuns() {
        return coordinator.recentRuns();
    }

    @GetMapping("/runs/{runId}")
    public IngestionRun run(@PathVariable String runId) {
        return coordinator.findRun(runId)
                .orElseThrow(() -> new PipelineException("Ingestion run " + runId + " not found", "RUN_NOT_FOUND",
                        Map.of("run_id", runId), null));
    }

    @GetMapping("/runs/active")
    public ResponseEntity<IngestionRun> activeRun() {
        return coordinator.activeRun()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
