package io.newsdigest.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "analysis")
public record AnalysisProperties(
        Duration generationTimeout,
        int maxArticles,
        int contentCharsPerArticle,
        Duration cacheTtl
) {}
