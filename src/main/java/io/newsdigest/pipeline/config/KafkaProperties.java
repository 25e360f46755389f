package io.newsdigest.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kafka.topics")
public record KafkaProperties(
        String articleIngested,
        String ingestionCompleted,
        String articlesDeleted
) {}
