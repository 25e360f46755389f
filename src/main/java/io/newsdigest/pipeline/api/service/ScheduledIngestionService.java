package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.IngestionRun;
import io.newsdigest.pipeline.config.RssConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class ScheduledIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledIngestionService.class);

    private final IngestionCoordinator coordinator;
    private final RssConfig rssConfig;

    public ScheduledIngestionService(IngestionCoordinator coordinator, RssConfig rssConfig) {
        this.coordinator = coordinator;
        this.rssConfig = rssConfig;
    }

    @Scheduled(
            fixedRateString = "#{@rssProps.scheduleIntervalMs}",
            initialDelayString = "#{@rssProps.initialDelayMs}"
    )
    public void ingestAllFeeds() {
        if (!rssConfig.processing().enableScheduling()) {
            return;
        }

        try {
            IngestionRun run = coordinator.trigger("scheduled");
            logger.info("Scheduled ingestion: run {} is {}", run.runId(), run.status());
        } catch (RuntimeException e) {
            logger.error("Failed to start scheduled ingestion: {}", e.getMessage(), e);
        }
    }
}
