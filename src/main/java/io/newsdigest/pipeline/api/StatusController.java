package io.newsdigest.pipeline.api;

import io.newsdigest.pipeline.api.dto.IngestionRun;
import io.newsdigest.pipeline.api.service.ArticleQueryService;
import io.newsdigest.pipeline.api.service.IngestionCoordinator;
import io.newsdigest.pipeline.vector.VectorStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/status")
public class StatusController {

    private final ArticleQueryService articleQuery;
    private final VectorStore vectorStore;
    private final IngestionCoordinator coordinator;

    public StatusController(ArticleQueryService articleQuery, VectorStore vectorStore, IngestionCoordinator coordinator) {
        this.articleQuery = articleQuery;
        this.vectorStore = vectorStore;
        this.coordinator = coordinator;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> status() {
        long articles = articleQuery.count();
        int vectors = vectorStore.size();

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("service", "news-pipeline");
        status.put("timestamp", Instant.now());
        status.put("articles", articles);
        status.put("indexed_articles", vectors);
        status.put("index_lag", Math.max(0, articles - vectors));
        status.put("active_run", coordinator.activeRun().map(IngestionRun::runId).orElse(null));

        return ResponseEntity.ok(status);
    }
}
