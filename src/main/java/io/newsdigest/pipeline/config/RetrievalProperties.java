package io.newsdigest.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retrieval")
public record RetrievalProperties(
        int defaultLimit,
        int maxLimit,
        double minScore,
        int snippetLength,
        int maxAiHighlights
) {
    public int clampLimit(Integer requested) {
        if (requested == null) return defaultLimit;
        return Math.max(1, Math.min(requested, maxLimit));
    }
}
