package io.newsdigest.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the chat model that writes summaries, analyses and search highlights.
 */
@ConfigurationProperties(prefix = "llm")
public record LlmProperties(
        String apiKey,
        String baseUrl,
        String modelName,
        double temperature,
        Duration timeout,
        int concurrency
) {}
