package io.newsdigest.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "embedding")
public record EmbeddingProperties(
        String apiKey,
        String baseUrl,
        String modelName,
        Duration timeout,
        int maxInputChars
) {}
