package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.DeletionReport;
import io.newsdigest.pipeline.api.dto.IngestionReport;
import io.newsdigest.pipeline.api.dto.kafka.ArticleIngestedEvent;
import io.newsdigest.pipeline.api.dto.kafka.ArticlesDeletedEvent;
import io.newsdigest.pipeline.api.dto.kafka.IngestionCompletedEvent;
import io.newsdigest.pipeline.config.KafkaProperties;
import io.newsdigest.pipeline.model.Article;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget pipeline notifications. A failed send is logged and never fails the operation that caused it.
 */
@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties topics;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
    }

    public void publishArticleIngested(Article article, String runId) {
        try {
            ArticleIngestedEvent event = ArticleIngestedEvent.create(
                    article.getId(),
                    runId,
                    article.getTitle(),
                    article.getUrl(),
                    article.getSource(),
                    article.getPublishedAt(),
                    article.getFingerprint()
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.articleIngested(), String.valueOf(article.getId()), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent article ingested event: {} to partition: {}",
                            article.getId(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send article ingested event: {}", article.getId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing article ingested event for article: {}", article.getId(), e);
        }
    }

    public void publishIngestionCompleted(IngestionReport report) {
        try {
            long durationMs = Duration.between(report.startedAt(), report.finishedAt()).toMillis();

            IngestionCompletedEvent event = IngestionCompletedEvent.create(
                    report.runId(),
                    report.feeds().size(),
                    report.totalFetched(),
                    report.totalNew(),
                    report.totalDuplicate(),
                    report.totalErrors(),
                    durationMs
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.ingestionCompleted(), report.runId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent ingestion completed event: {} ({} new of {} fetched)",
                            report.runId(), report.totalNew(), report.totalFetched());
                } else {
                    logger.error("Failed to send ingestion completed event: {}", report.runId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing ingestion completed event for run: {}", report.runId(), e);
        }
    }

    public void publishArticlesDeleted(DeletionReport report) {
        try {
            ArticlesDeletedEvent event = ArticlesDeletedEvent.create(
                    report.deletedCount(),
                    report.deletedFromVectorStore(),
                    report.remainingArticles(),
                    report.filtersApplied(),
                    report.isConsistent()
            );

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.articlesDeleted(), event.batchId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent articles deleted event: {} ({} articles)", event.batchId(), report.deletedCount());
                } else {
                    logger.error("Failed to send articles deleted event: {}", event.batchId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing articles deleted event", e);
        }
    }
}
